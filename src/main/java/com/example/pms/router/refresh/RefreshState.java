package com.example.pms.router.refresh;

/**
 * Embedding lifecycle of one record.
 */
public enum RefreshState {
    FRESH,
    STALE,
    REFRESHING,
    /** Retries exhausted this run; picked up again next run. */
    FAILED,
    /** Excluded from refresh until the record's content changes. */
    PARKED
}
