package com.example.pms.router.relation;

import com.example.pms.router.model.FkTier;
import com.example.pms.router.model.RecordType;
import com.example.pms.router.model.RelationDomain;

/**
 * One declarative single-hop lookup. The SQL binds {@code :focusId}, {@code :tenantId} and
 * {@code :limit} and returns {@code entity_id}, {@code occurred_at} and {@code embedding}.
 */
public record RelationQuery(String name,
                            RecordType focusType,
                            RelationDomain domain,
                            FkTier tier,
                            RecordType itemType,
                            String sql) {
}
