package com.example.pms.router.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * The record the caller is looking at. The embedding is looked up lazily and may be absent.
 */
public record FocusedEntity(RecordType type, String id, @JsonIgnore float[] embedding) {

    public FocusedEntity withEmbedding(float[] vector) {
        return new FocusedEntity(type, id, vector);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
