package com.example.pms.router.refresh;

import com.example.pms.router.model.RecordType;

import java.time.Instant;
import java.util.List;

public interface StaleEntityDao {

    /**
     * Records never embedded or edited since their last embedding, newest first. Parked records
     * are excluded unless their content changed after they were parked.
     */
    List<StaleEntity> findStale(RecordType type, int limit);

    /**
     * Stores vector, text and refresh time in one statement. Guarded so that a record already
     * refreshed by a concurrent run is left untouched.
     *
     * @return {@code true} when the row was updated
     */
    boolean writeEmbedding(StaleEntity entity, float[] vector, String text, Instant refreshedAt);

    void recordFailure(RefreshJob job, Instant at);

    void clearFailures(StaleEntity entity);
}
