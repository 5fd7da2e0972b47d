package com.example.pms.router.refresh;

import java.time.Duration;

/**
 * Exponential backoff: the n-th retry waits {@code baseDelay * 2^(n-1)}.
 */
public record BackoffPolicy(int maxRetries, Duration baseDelay) {

    public BackoffPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
    }

    /**
     * @param retry 1-based retry number
     */
    public Duration delayFor(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        return baseDelay.multipliedBy(1L << Math.min(retry - 1, 16));
    }
}
