package com.example.pms.router.audit;

import com.example.pms.router.config.RouterProperties;
import com.example.pms.router.model.ExtractedEntity;
import com.example.pms.router.model.RoutingContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists extracted entities for audit. Failures are logged and never fail the request.
 */
@Slf4j
@Service
public class ExtractionAuditService {

    private final ExtractionAuditRepository repository;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    @Autowired
    public ExtractionAuditService(ExtractionAuditRepository repository, ObjectMapper objectMapper,
                                  RouterProperties properties) {
        this(repository, objectMapper, properties.getAudit().isEnabled());
    }

    public ExtractionAuditService(ExtractionAuditRepository repository, ObjectMapper objectMapper, boolean enabled) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return {@code true} when the row was saved
     */
    public Mono<Boolean> record(RoutingContext ctx) {
        return Mono.fromCallable(() -> {
                    repository.save(mapToEntity(ctx));
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(ex -> {
                    log.warn("[extraction-audit] Failed to persist audit for request {}: {}",
                            ctx.getRequestId(), ex.getMessage());
                    return Mono.just(false);
                });
    }

    ExtractionAuditEntity mapToEntity(RoutingContext ctx) throws JsonProcessingException {
        List<ExtractedEntity> entities = Optional.ofNullable(ctx.getEntities()).orElse(List.of());
        List<Map<String, Object>> rows = entities.stream().map(e -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("type", e.type().name());
            row.put("text", e.text());
            row.put("confidence", e.confidence());
            row.put("source", e.source().name());
            return row;
        }).toList();

        return new ExtractionAuditEntity()
                .setRequestId(ctx.getRequestId())
                .setTenantId(ctx.getAuth().tenantId())
                .setUserId(ctx.getAuth().userId())
                .setLane(ctx.getDecision().lane().name())
                .setReason(ctx.getDecision().reason())
                .setEntityCount(entities.size())
                .setEntitiesJson(objectMapper.writeValueAsString(rows))
                .setModelUsed(ctx.isModelExtractionUsed())
                .setDegraded(ctx.isExtractionDegraded())
                .setCreatedAt(Optional.ofNullable(ctx.getNow()).orElse(Instant.now()));
    }
}
