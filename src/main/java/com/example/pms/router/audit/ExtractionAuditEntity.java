package com.example.pms.router.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;

/**
 * Entities extracted for one query. The query text itself is not stored.
 */
@Data
@Accessors(chain = true)
@Entity
@Table(name = "extraction_audit", schema = "public")
public class ExtractionAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false)
    private String requestId;

    @Column(name = "yacht_id", nullable = false)
    private String tenantId;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "lane", nullable = false)
    private String lane;

    @Column(name = "reason")
    private String reason;

    @Column(name = "entity_count", nullable = false)
    private Integer entityCount = 0;

    @Column(name = "entities", columnDefinition = "text")
    private String entitiesJson;

    @Column(name = "model_used", nullable = false)
    private boolean modelUsed;

    @Column(name = "degraded", nullable = false)
    private boolean degraded;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
