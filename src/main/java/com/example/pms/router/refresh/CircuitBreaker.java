package com.example.pms.router.refresh;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure circuit breaker for the embedding provider.
 * <p>
 * CLOSED counts consecutive failures and opens at the threshold. OPEN rejects calls until the
 * cooldown has elapsed, then lets a single probe through as HALF_OPEN. A successful probe
 * closes the circuit; a failed one reopens it.
 */
@Slf4j
public class CircuitBreaker {

    public enum State {
        CLOSED, OPEN, HALF_OPEN
    }

    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean probeInFlight;
    private int trips;

    public CircuitBreaker(int failureThreshold, Duration cooldown, Clock clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.cooldown = cooldown == null ? Duration.ZERO : cooldown;
        this.clock = clock;
    }

    public synchronized boolean allowRequest() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.instant().isBefore(openedAt.plus(cooldown))) {
                    return false;
                }
                state = State.HALF_OPEN;
                probeInFlight = true;
                log.info("[circuit-breaker] Cooldown elapsed, probing provider");
                return true;
            case HALF_OPEN:
            default:
                if (probeInFlight) {
                    return false;
                }
                probeInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        if (state != State.CLOSED) {
            log.info("[circuit-breaker] Provider recovered, closing circuit");
        }
        state = State.CLOSED;
        consecutiveFailures = 0;
        probeInFlight = false;
        openedAt = null;
    }

    /**
     * The call got an answer that is not a health signal either way. Frees a half-open probe so
     * the next call can probe again; counters are untouched.
     */
    public synchronized void ignoreOutcome() {
        probeInFlight = false;
    }

    /**
     * @return {@code true} when this failure opened the circuit
     */
    public synchronized boolean recordFailure() {
        consecutiveFailures++;
        if (state == State.HALF_OPEN || (state == State.CLOSED && consecutiveFailures >= failureThreshold)) {
            state = State.OPEN;
            openedAt = clock.instant();
            probeInFlight = false;
            trips++;
            log.warn("[circuit-breaker] Circuit opened after {} consecutive failures", consecutiveFailures);
            return true;
        }
        return false;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized int trips() {
        return trips;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }
}
