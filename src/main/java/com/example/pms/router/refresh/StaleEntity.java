package com.example.pms.router.refresh;

import com.example.pms.router.model.RecordType;

import java.time.Instant;
import java.util.Map;

/**
 * A record whose embedding is missing or older than its content.
 *
 * @param fields         source columns used to build the embedding text
 * @param failureCount   failed runs recorded since the content last changed
 */
public record StaleEntity(RecordType type,
                          String id,
                          String tenantId,
                          Instant updatedAt,
                          Instant embeddingUpdatedAt,
                          Map<String, String> fields,
                          int failureCount) {

    public StaleEntity {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public String stalenessReason() {
        return embeddingUpdatedAt == null ? "never_embedded" : "content_changed";
    }
}
