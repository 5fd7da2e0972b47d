package com.example.pms.router.relation;

import com.example.pms.router.model.RecordType;

import java.time.Instant;

/** Raw row returned by a relation lookup. */
public record RelationRow(RecordType type, String id, Instant occurredAt, float[] embedding) {
}
