package com.example.pms.router.refresh;

import com.example.pms.router.model.RecordType;
import com.example.pms.router.util.EntityTables;
import com.example.pms.router.util.VectorConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSetMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
@RequiredArgsConstructor
public class JdbcStaleEntityDao implements StaleEntityDao {

    private static final Set<String> RESERVED = Set.of(
            "id", "yacht_id", "updated_at", "embedding_updated_at", "failure_count");

    private static final String EQUIPMENT_CONTEXT = """
            , e.name as equipment_name, e.manufacturer as equipment_manufacturer,
              e.model as equipment_model, e.location as equipment_location""";

    private static final String EQUIPMENT_JOIN =
            "left join equipment e on e.id = t.equipment_id and e.yacht_id = t.yacht_id";

    private static final String SELECT_STALE = """
            select t.id, t.yacht_id, t.updated_at, t.embedding_updated_at, %s%s,
                   case when j.updated_at >= t.updated_at then j.failure_count else 0 end as failure_count
            from %s t
            %s
            left join embedding_refresh_jobs j
              on j.yacht_id = t.yacht_id and j.entity_type = '%s' and j.entity_id = t.id
            where t.deleted_at is null
              and (t.embedding_updated_at is null or t.updated_at > t.embedding_updated_at)
              and (j.state is null or j.state <> 'PARKED' or t.updated_at > j.updated_at)
            order by t.updated_at desc
            limit :limit
            """;

    private static final Map<RecordType, String> COLUMNS = new EnumMap<>(RecordType.class);

    static {
        COLUMNS.put(RecordType.WORK_ORDER, "t.wo_number, t.title, t.description, t.completion_notes");
        COLUMNS.put(RecordType.EQUIPMENT, "t.name, t.manufacturer, t.model, t.serial_number, t.location, t.system_type");
        COLUMNS.put(RecordType.FAULT, "t.title, t.description, t.severity, t.status");
        COLUMNS.put(RecordType.PART, "t.name, t.part_number, t.manufacturer, t.description, t.category");
        COLUMNS.put(RecordType.ATTACHMENT, "t.filename, t.description, t.mime_type");
        COLUMNS.put(RecordType.NOTE, "t.note_text");
    }

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public List<StaleEntity> findStale(RecordType type, int limit) {
        String columns = COLUMNS.get(type);
        if (columns == null || limit <= 0) {
            return List.of();
        }
        boolean withEquipment = type == RecordType.WORK_ORDER || type == RecordType.FAULT;
        String sql = String.format(SELECT_STALE,
                columns,
                withEquipment ? EQUIPMENT_CONTEXT : "",
                EntityTables.table(type),
                withEquipment ? EQUIPMENT_JOIN : "",
                type.value());
        return jdbc.query(sql, new MapSqlParameterSource("limit", limit), staleMapper(type));
    }

    @Override
    public boolean writeEmbedding(StaleEntity entity, float[] vector, String text, Instant refreshedAt) {
        String sql = """
                update %s
                set embedding = :embedding, embedding_text = :text, embedding_updated_at = :refreshedAt
                where id = :id and yacht_id = :tenantId
                  and (embedding_updated_at is null or updated_at > embedding_updated_at)
                """.formatted(EntityTables.table(entity.type()));
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("embedding", VectorConverter.toPgVector(vector))
                .addValue("text", text)
                .addValue("refreshedAt", Timestamp.from(refreshedAt))
                .addValue("id", entity.id())
                .addValue("tenantId", entity.tenantId());
        return jdbc.update(sql, params) > 0;
    }

    @Override
    public void recordFailure(RefreshJob job, Instant at) {
        String sql = """
                insert into embedding_refresh_jobs
                  (yacht_id, entity_type, entity_id, state, staleness_reason, failure_count, retry_count, last_error, updated_at)
                values
                  (:tenantId, :entityType, :entityId, :state, :reason, :failureCount, :retryCount, :lastError, :at)
                on conflict (yacht_id, entity_type, entity_id) do update
                set state = excluded.state,
                    staleness_reason = excluded.staleness_reason,
                    failure_count = excluded.failure_count,
                    retry_count = excluded.retry_count,
                    last_error = excluded.last_error,
                    updated_at = excluded.updated_at
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", job.getTenantId())
                .addValue("entityType", job.getEntityType().value())
                .addValue("entityId", job.getEntityId())
                .addValue("state", job.getState().name())
                .addValue("reason", job.getStalenessReason())
                .addValue("failureCount", job.getFailureCount())
                .addValue("retryCount", job.getRetryCount())
                .addValue("lastError", job.getLastError())
                .addValue("at", Timestamp.from(at));
        jdbc.update(sql, params);
    }

    @Override
    public void clearFailures(StaleEntity entity) {
        if (entity.failureCount() == 0) {
            return;
        }
        jdbc.update("""
                delete from embedding_refresh_jobs
                where yacht_id = :tenantId and entity_type = :entityType and entity_id = :entityId
                """, new MapSqlParameterSource()
                .addValue("tenantId", entity.tenantId())
                .addValue("entityType", entity.type().value())
                .addValue("entityId", entity.id()));
    }

    private static RowMapper<StaleEntity> staleMapper(RecordType type) {
        return (rs, rowNum) -> {
            ResultSetMetaData meta = rs.getMetaData();
            Map<String, String> fields = new LinkedHashMap<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                String column = meta.getColumnLabel(i);
                if (RESERVED.contains(column)) {
                    continue;
                }
                String value = rs.getString(i);
                if (value != null) {
                    fields.put(column, value);
                }
            }
            Timestamp updated = rs.getTimestamp("updated_at");
            Timestamp embedded = rs.getTimestamp("embedding_updated_at");
            return new StaleEntity(type,
                    rs.getString("id"),
                    rs.getString("yacht_id"),
                    updated == null ? null : updated.toInstant(),
                    embedded == null ? null : embedded.toInstant(),
                    fields,
                    rs.getInt("failure_count"));
        };
    }
}
