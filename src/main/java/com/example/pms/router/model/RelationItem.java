package com.example.pms.router.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A record related to the focus. The embedding is carried for scoring only and never serialized.
 */
public record RelationItem(RecordType entityType,
                           String entityId,
                           FkTier tier,
                           int tierWeight,
                           Instant occurredAt,
                           @JsonIgnore float[] embedding,
                           Double cosine,
                           double finalScore,
                           boolean userAdded) {

    public static RelationItem of(RecordType type, String id, FkTier tier, int weight,
                                  Instant occurredAt, float[] embedding, boolean userAdded) {
        return new RelationItem(type, id, tier, weight, occurredAt, embedding, null, weight, userAdded);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public RelationItem withScore(Double cosineScore, double score) {
        return new RelationItem(entityType, entityId, tier, tierWeight, occurredAt, embedding,
                cosineScore, score, userAdded);
    }
}
