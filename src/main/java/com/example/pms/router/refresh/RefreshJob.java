package com.example.pms.router.refresh;

import com.example.pms.router.model.RecordType;
import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Refresh attempt for one record within a run.
 */
@Data
@Accessors(chain = true)
public class RefreshJob {

    private RecordType entityType;
    private String entityId;
    private String tenantId;
    private String stalenessReason;
    private int retryCount;
    private int failureCount;
    private String lastError;
    private RefreshState state = RefreshState.STALE;

    public static RefreshJob of(StaleEntity entity) {
        return new RefreshJob()
                .setEntityType(entity.type())
                .setEntityId(entity.id())
                .setTenantId(entity.tenantId())
                .setStalenessReason(entity.stalenessReason())
                .setFailureCount(entity.failureCount());
    }
}
