package com.example.pms.router.relation;

import com.example.pms.router.model.RecordType;
import com.example.pms.router.util.EntityTables;
import com.example.pms.router.util.VectorConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the catalog statements against PostgreSQL. Data access failures propagate so the
 * caller can degrade the affected domain only.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcRelationQueryDao implements RelationQueryDao {

    private static final String USER_ADDED_SQL = """
            select r.to_type as entity_type, r.to_id as entity_id, r.created_at as occurred_at
            from user_added_relations r
            where r.yacht_id = :tenantId and r.from_type = :focusType and r.from_id = :focusId
            union
            select r.from_type, r.from_id, r.created_at
            from user_added_relations r
            where r.yacht_id = :tenantId and r.to_type = :focusType and r.to_id = :focusId
            order by occurred_at desc
            limit :limit
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public List<RelationRow> fetch(RelationQuery query, String focusId, String tenantId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("focusId", focusId)
                .addValue("tenantId", tenantId)
                .addValue("limit", limit);
        return jdbc.query(query.sql(), params,
                (rs, i) -> new RelationRow(query.itemType(), rs.getString("entity_id"),
                        instant(rs, "occurred_at"), VectorConverter.toFloatArray(rs.getObject("embedding"))));
    }

    @Override
    public List<RelationRow> fetchUserAdded(RecordType focusType, String focusId, String tenantId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("focusType", focusType.value())
                .addValue("focusId", focusId)
                .addValue("tenantId", tenantId)
                .addValue("limit", limit);
        List<RelationRow> rows = new ArrayList<>();
        jdbc.query(USER_ADDED_SQL, params, rs -> {
            String rawType = rs.getString("entity_type");
            try {
                rows.add(new RelationRow(RecordType.fromValue(rawType), rs.getString("entity_id"),
                        instant(rs, "occurred_at"), null));
            } catch (IllegalArgumentException e) {
                log.debug("[relation-dao] Skipping user-added link with unknown type {}", rawType);
            }
        });
        return rows;
    }

    @Override
    public Optional<float[]> findEmbedding(RecordType type, String id, String tenantId) {
        Optional<String> table = EntityTables.embeddingTable(type);
        if (table.isEmpty()) {
            return Optional.empty();
        }
        String sql = "select embedding from " + table.get() + " where id = :id and yacht_id = :tenantId";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("tenantId", tenantId);
        List<float[]> found = jdbc.query(sql, params, (rs, i) -> VectorConverter.toFloatArray(rs.getObject("embedding")));
        return found.stream().filter(v -> v != null && v.length > 0).findFirst();
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
