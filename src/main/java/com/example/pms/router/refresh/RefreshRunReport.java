package com.example.pms.router.refresh;

import com.example.pms.router.model.RecordType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters for one worker run. Items may be processed concurrently, so every mutator is
 * synchronized.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RefreshRunReport {

    private final boolean dryRun;
    private final double costPerMillionTokens;
    private final Instant startedAt;
    private Instant finishedAt;

    private int staleCount;
    private final Map<String, Integer> refreshedByType = new LinkedHashMap<>();
    private int errors;
    private final Map<String, Integer> errorByCode = new LinkedHashMap<>();
    private int apiCalls;
    private long tokensUsed;
    private int retries;
    private int skipped;
    private int deferred;
    private int parked;
    private int circuitBreakerTrips;
    private int writes;
    private boolean cancelled;

    public RefreshRunReport(boolean dryRun, double costPerMillionTokens, Instant startedAt) {
        this.dryRun = dryRun;
        this.costPerMillionTokens = costPerMillionTokens;
        this.startedAt = startedAt;
    }

    /** Rough token count used for cost estimates. */
    public static long estimateTokens(String text) {
        return text == null || text.isEmpty() ? 0 : (text.length() + 3) / 4;
    }

    public synchronized void addStale(int count) {
        staleCount += count;
    }

    public synchronized void recordRefreshed(RecordType type, long tokens, boolean written) {
        refreshedByType.merge(type.value(), 1, Integer::sum);
        tokensUsed += tokens;
        if (written) {
            writes++;
        }
    }

    public synchronized void recordApiCall() {
        apiCalls++;
    }

    public synchronized void recordTokens(long tokens) {
        tokensUsed += tokens;
    }

    public synchronized void recordRetry() {
        retries++;
    }

    public synchronized void recordError(String code) {
        errors++;
        errorByCode.merge(code, 1, Integer::sum);
    }

    public synchronized void recordSkipped() {
        skipped++;
    }

    public synchronized void recordSkipped(String code) {
        skipped++;
        errorByCode.merge(code, 1, Integer::sum);
    }

    public synchronized void recordDeferred() {
        deferred++;
    }

    public synchronized void recordParked() {
        parked++;
    }

    public synchronized void recordCircuitTrip() {
        circuitBreakerTrips++;
    }

    public synchronized void cancel() {
        cancelled = true;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized void finish(Instant at) {
        finishedAt = at;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized int getStaleCount() {
        return staleCount;
    }

    public synchronized Map<String, Integer> getRefreshedByType() {
        return Map.copyOf(refreshedByType);
    }

    public synchronized int getTotal() {
        return refreshedByType.values().stream().mapToInt(Integer::intValue).sum();
    }

    public synchronized int getErrors() {
        return errors;
    }

    public synchronized Map<String, Integer> getErrorByCode() {
        return Map.copyOf(errorByCode);
    }

    public synchronized int getApiCalls() {
        return apiCalls;
    }

    public synchronized long getTokensUsed() {
        return tokensUsed;
    }

    public synchronized int getRetries() {
        return retries;
    }

    public synchronized int getSkipped() {
        return skipped;
    }

    public synchronized int getDeferred() {
        return deferred;
    }

    public synchronized int getParked() {
        return parked;
    }

    public synchronized int getCircuitBreakerTrips() {
        return circuitBreakerTrips;
    }

    public synchronized int getWrites() {
        return writes;
    }

    public synchronized double getCostEstimate() {
        return tokensUsed / 1_000_000.0 * costPerMillionTokens;
    }
}
