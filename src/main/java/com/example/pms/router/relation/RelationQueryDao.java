package com.example.pms.router.relation;

import com.example.pms.router.model.RecordType;

import java.util.List;
import java.util.Optional;

/**
 * Read-only, tenant-scoped access to the entity store.
 */
public interface RelationQueryDao {

    List<RelationRow> fetch(RelationQuery query, String focusId, String tenantId, int limit);

    /**
     * Links users added by hand, in either direction.
     */
    List<RelationRow> fetchUserAdded(RecordType focusType, String focusId, String tenantId, int limit);

    Optional<float[]> findEmbedding(RecordType type, String id, String tenantId);
}
