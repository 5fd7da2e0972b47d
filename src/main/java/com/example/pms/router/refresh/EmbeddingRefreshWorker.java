package com.example.pms.router.refresh;

import com.example.pms.router.config.RouterProperties;
import com.example.pms.router.model.RecordType;
import com.example.pms.router.validation.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Re-embeds records whose content changed since their last embedding.
 * <p>
 * One run at a time; a trigger that arrives while a run is active is skipped. Each run is
 * bounded by an item budget and a wall-clock budget, both checked between items.
 */
@Slf4j
@Component
public class EmbeddingRefreshWorker {

    /** Refresh priority. */
    static final List<RecordType> ORDER = List.of(
            RecordType.WORK_ORDER, RecordType.EQUIPMENT, RecordType.FAULT,
            RecordType.PART, RecordType.ATTACHMENT, RecordType.NOTE);

    private final StaleEntityDao dao;
    private final EmbeddingProvider provider;
    private final CircuitBreaker circuitBreaker;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RouterProperties.Refresh config;
    private final BackoffPolicy backoff;
    private final ReentrantLock runLock = new ReentrantLock();

    @Autowired
    public EmbeddingRefreshWorker(StaleEntityDao dao,
                                  EmbeddingProvider provider,
                                  Sleeper sleeper,
                                  Clock clock,
                                  RouterProperties properties) {
        this(dao, provider,
                new CircuitBreaker(properties.getRefresh().getCircuitFailureThreshold(),
                        properties.getRefresh().getCircuitCooldown(), clock),
                sleeper, clock, properties.getRefresh());
    }

    public EmbeddingRefreshWorker(StaleEntityDao dao,
                                  EmbeddingProvider provider,
                                  CircuitBreaker circuitBreaker,
                                  Sleeper sleeper,
                                  Clock clock,
                                  RouterProperties.Refresh config) {
        this.dao = dao;
        this.provider = provider;
        this.circuitBreaker = circuitBreaker;
        this.sleeper = sleeper;
        this.clock = clock;
        this.config = config;
        this.backoff = new BackoffPolicy(config.getMaxRetries(), config.getBaseDelay());
    }

    @Scheduled(fixedDelayString = "${router.refresh.poll-interval-ms:3600000}",
            initialDelayString = "${router.refresh.initial-delay-ms:60000}")
    public void scheduledRun() {
        if (!config.isEnabled()) {
            log.debug("[embedding-refresh] Disabled, skipping scheduled run");
            return;
        }
        run(false);
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.state();
    }

    /**
     * @return the run report, or empty when another run is already active
     */
    public Optional<RefreshRunReport> run(boolean dryRun) {
        if (!runLock.tryLock()) {
            log.info("[embedding-refresh] Run already in progress, trigger skipped");
            return Optional.empty();
        }
        try {
            return Optional.of(doRun(dryRun));
        } finally {
            runLock.unlock();
        }
    }

    private RefreshRunReport doRun(boolean dryRun) {
        Instant started = clock.instant();
        Instant deadline = started.plus(config.getMaxDuration());
        RefreshRunReport report = new RefreshRunReport(dryRun, config.getCostPerMillionTokens(), started);
        int tripsBefore = circuitBreaker.trips();
        AtomicInteger remaining = new AtomicInteger(Math.max(0, config.getMaxPerRun()));

        log.info("[embedding-refresh] Run started dryRun={} maxPerRun={} batchSize={} provider={}",
                dryRun, config.getMaxPerRun(), config.getBatchSize(), provider.modelName());

        for (RecordType type : ORDER) {
            if (report.isCancelled() || remaining.get() <= 0 || !clock.instant().isBefore(deadline)) {
                break;
            }
            List<StaleEntity> stale;
            try {
                stale = dao.findStale(type, remaining.get());
            } catch (DataAccessException e) {
                log.warn("[embedding-refresh] Stale lookup for {} failed – {}", type.value(), e.getMessage());
                report.recordError("STALE_LOOKUP_FAILED");
                continue;
            }
            if (stale.isEmpty()) {
                continue;
            }
            report.addStale(stale.size());
            remaining.addAndGet(-stale.size());
            log.info("[embedding-refresh] Found {} stale {} records", stale.size(), type.value());

            int batchSize = Math.max(1, config.getBatchSize());
            for (int i = 0; i < stale.size() && !report.isCancelled(); i += batchSize) {
                List<StaleEntity> batch = stale.subList(i, Math.min(i + batchSize, stale.size()));
                processBatch(batch, report, dryRun, deadline);
            }
        }

        for (int i = tripsBefore; i < circuitBreaker.trips(); i++) {
            report.recordCircuitTrip();
        }
        report.finish(clock.instant());
        log.info("[embedding-refresh] Run finished dryRun={} cancelled={} stale={} refreshed={} writes={} errors={} errorByCode={} "
                        + "apiCalls={} tokens={} retries={} skipped={} deferred={} parked={} trips={} cost=${}",
                dryRun, report.isCancelled(), report.getStaleCount(), report.getTotal(), report.getWrites(), report.getErrors(),
                report.getErrorByCode(), report.getApiCalls(), report.getTokensUsed(), report.getRetries(),
                report.getSkipped(), report.getDeferred(), report.getParked(), report.getCircuitBreakerTrips(),
                String.format("%.4f", report.getCostEstimate()));
        return report;
    }

    private void processBatch(List<StaleEntity> batch, RefreshRunReport report, boolean dryRun, Instant deadline) {
        Flux.fromIterable(batch)
                .flatMap(entity -> Mono.fromRunnable(() -> refreshOne(entity, report, dryRun, deadline))
                        .subscribeOn(Schedulers.boundedElastic()), Math.max(1, config.getConcurrency()))
                .then()
                .block();
    }

    void refreshOne(StaleEntity entity, RefreshRunReport report, boolean dryRun, Instant deadline) {
        if (report.isCancelled() || !clock.instant().isBefore(deadline)) {
            report.recordDeferred();
            return;
        }
        String text = EmbeddingTextBuilder.build(entity.type(), entity.fields());
        if (text.length() > config.getMaxInputChars()) {
            text = text.substring(0, config.getMaxInputChars());
        }
        if (text.isBlank()) {
            report.recordSkipped();
            return;
        }
        long tokens = RefreshRunReport.estimateTokens(text);

        if (dryRun) {
            log.debug("[embedding-refresh] Would embed {} {}", entity.type().value(), shortId(entity.id()));
            report.recordRefreshed(entity.type(), tokens, false);
            return;
        }

        RefreshJob job = RefreshJob.of(entity);
        Optional<float[]> vector = embedWithRetry(job, text, report);
        if (vector.isEmpty()) {
            return;
        }
        report.recordTokens(tokens);
        try {
            boolean written = dao.writeEmbedding(entity, vector.get(), text, clock.instant());
            job.setState(RefreshState.FRESH);
            if (written) {
                report.recordRefreshed(entity.type(), 0, true);
                dao.clearFailures(entity);
            } else {
                log.debug("[embedding-refresh] {} {} already refreshed elsewhere", entity.type().value(), shortId(entity.id()));
                report.recordSkipped();
            }
        } catch (DataAccessException e) {
            log.warn("[embedding-refresh] Write failed for {} {} – {}", entity.type().value(), shortId(entity.id()), e.getMessage());
            report.recordError("WRITE_FAILED");
        }
    }

    private Optional<float[]> embedWithRetry(RefreshJob job, String text, RefreshRunReport report) {
        for (int attempt = 0; ; attempt++) {
            if (!circuitBreaker.allowRequest()) {
                job.setState(RefreshState.STALE);
                report.recordSkipped(ErrorCode.CIRCUIT_OPEN.name());
                return Optional.empty();
            }
            job.setState(RefreshState.REFRESHING);
            try {
                report.recordApiCall();
                float[] vector = provider.embed(text);
                circuitBreaker.recordSuccess();
                return Optional.of(vector);
            } catch (RuntimeException e) {
                RefreshErrorClassifier.Classification cls = RefreshErrorClassifier.classify(e);
                if (cls.dependencyFailure()) {
                    circuitBreaker.recordFailure();
                } else {
                    circuitBreaker.ignoreOutcome();
                }
                job.setRetryCount(attempt).setLastError(cls.code() + ": " + abbreviate(e.getMessage()));

                if (!cls.retryable()) {
                    report.recordError(cls.code());
                    park(job, report, cls.errorCode());
                    return Optional.empty();
                }
                if (attempt >= backoff.maxRetries()) {
                    report.recordError(cls.code());
                    fail(job, report);
                    return Optional.empty();
                }
                report.recordRetry();
                Duration delay = backoff.delayFor(attempt + 1);
                log.debug("[embedding-refresh] {} on {} {}, retry {} in {}ms", cls.code(),
                        job.getEntityType().value(), shortId(job.getEntityId()), attempt + 1, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    // pooled thread: cancel the run instead of leaving the flag set for the next task
                    log.warn("[embedding-refresh] Interrupted during backoff, cancelling run");
                    report.cancel();
                    job.setState(RefreshState.STALE);
                    report.recordDeferred();
                    return Optional.empty();
                }
            }
        }
    }

    private void fail(RefreshJob job, RefreshRunReport report) {
        job.setFailureCount(job.getFailureCount() + 1);
        if (job.getFailureCount() >= config.getParkAfterFailures()) {
            park(job, report, ErrorCode.REFRESH_TRANSIENT_FAILURE);
            return;
        }
        job.setState(RefreshState.FAILED);
        log.warn("[embedding-refresh] {} for {} {} after {} retries ({} failed runs)",
                ErrorCode.REFRESH_TRANSIENT_FAILURE, job.getEntityType().value(), shortId(job.getEntityId()),
                job.getRetryCount(), job.getFailureCount());
        persist(job);
    }

    private void park(RefreshJob job, RefreshRunReport report, ErrorCode reason) {
        job.setState(RefreshState.PARKED);
        report.recordParked();
        log.warn("[embedding-refresh] {} parked {} {} – {}", reason, job.getEntityType().value(),
                shortId(job.getEntityId()), job.getLastError());
        persist(job);
    }

    private void persist(RefreshJob job) {
        try {
            dao.recordFailure(job, clock.instant());
        } catch (DataAccessException e) {
            log.warn("[embedding-refresh] Could not record job state for {} {} – {}",
                    job.getEntityType().value(), shortId(job.getEntityId()), e.getMessage());
        }
    }

    private static String shortId(String id) {
        return id == null || id.length() <= 8 ? String.valueOf(id) : id.substring(0, 8) + "...";
    }

    private static String abbreviate(String message) {
        if (message == null) {
            return "";
        }
        String flat = message.replaceAll("\\s+", " ").trim();
        return flat.length() <= 160 ? flat : flat.substring(0, 160) + "...";
    }
}
