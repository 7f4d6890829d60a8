package com.raredisease.prioritization.run;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import com.raredisease.prioritization.core.model.RunHistory;
import com.raredisease.prioritization.core.model.RunRecord;
import com.raredisease.prioritization.core.model.RunState;
import com.raredisease.prioritization.fetch.EvidenceFetchAdapter;
import com.raredisease.prioritization.fetch.EvidenceFetchException;
import com.raredisease.prioritization.lock.KeyLock;
import com.raredisease.prioritization.lock.LocalKeyLock;
import com.raredisease.prioritization.logging.LogContext;
import com.raredisease.prioritization.metrics.NoOpPipelineMetrics;
import com.raredisease.prioritization.metrics.PipelineMetrics;
import com.raredisease.prioritization.reliability.ReliabilityScorer;
import com.raredisease.prioritization.store.EvidenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Idempotent, retry-aware evidence collection for one (disease, criterion) key.
 *
 * <p>Each call of {@link #process} is serialized per key through the {@link KeyLock}.
 * A key whose latest run succeeded with evidence is never fetched again, and a key
 * that has used up its attempt budget is left alone. Otherwise the adapter is called
 * until a run yields evidence or the budget is spent, writing exactly one
 * {@link RunRecord} per attempt.</p>
 */
public class RunManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RunManager.class);

    private final EvidenceStore store;
    private final KeyLock keyLock;
    private final ReliabilityScorer scorer;
    private final EvidenceValidator validator;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final ExecutorService fetchExecutor;

    private RunManager(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.scorer = Objects.requireNonNull(builder.scorer, "scorer is required");
        this.keyLock = builder.keyLock != null ? builder.keyLock : new LocalKeyLock();
        this.validator = builder.validator != null ? builder.validator : new EvidenceValidator();
        this.metrics = builder.metrics != null ? builder.metrics : NoOpPipelineMetrics.INSTANCE;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.defaultTimeout = builder.defaultTimeout;
        this.fetchExecutor = Executors.newCachedThreadPool(new FetchThreadFactory());
    }

    /**
     * Processes a key with the default fetch timeout.
     *
     * @return the active run record of the key after processing
     */
    public RunRecord process(String entityId, Criterion criterion, EvidenceFetchAdapter adapter, int maxAttempts) {
        return process(entityId, criterion, adapter, maxAttempts, defaultTimeout);
    }

    /**
     * Processes a key, bounding each fetch by the given timeout. A null timeout runs
     * the fetch on the calling thread without a bound.
     *
     * @return the active run record of the key after processing
     * @throws com.raredisease.prioritization.lock.LockAcquisitionException if the key stays locked too long
     */
    public RunRecord process(String entityId, Criterion criterion, EvidenceFetchAdapter adapter,
                             int maxAttempts, Duration timeout) {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(criterion, "criterion is required");
        Objects.requireNonNull(adapter, "adapter is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        return keyLock.withLock(lockKey(entityId, criterion), () -> {
            try (LogContext ignored = LogContext.forRun(entityId, criterion.key())) {
                return processLocked(entityId, criterion, adapter, maxAttempts, timeout);
            }
        });
    }

    /**
     * Current state of a key, derived from its stored history.
     */
    public RunState state(String entityId, Criterion criterion, int maxAttempts) {
        return store.history(entityId, criterion).state(maxAttempts);
    }

    public RunHistory history(String entityId, Criterion criterion) {
        return store.history(entityId, criterion);
    }

    private RunRecord processLocked(String entityId, Criterion criterion, EvidenceFetchAdapter adapter,
                                    int maxAttempts, Duration timeout) {
        RunHistory history = store.history(entityId, criterion);
        Optional<RunRecord> latest = history.latest();
        if (latest.isPresent() && latest.get().isSuccessful()) {
            log.debug("run.skipped entityId={} criterion={} reason=succeeded run={}",
                    entityId, criterion.key(), latest.get().runNumber());
            return latest.get();
        }
        if (history.size() >= maxAttempts) {
            log.debug("run.skipped entityId={} criterion={} reason=exhausted attempts={}",
                    entityId, criterion.key(), history.size());
            return latest.orElseThrow();
        }

        int runNumber = history.nextRunNumber();
        RunRecord record;
        while (true) {
            record = attempt(entityId, criterion, runNumber, adapter, timeout);
            store.appendRun(record);
            metrics.incrementRun(criterion, record.status());
            metrics.recordDroppedRecords(criterion, record.droppedRecords());
            log.info("run.recorded entityId={} criterion={} run={} status={} evidence={} dropped={}",
                    entityId, criterion.key(), runNumber, record.status(),
                    record.evidence().size(), record.droppedRecords());

            if (record.isSuccessful() || runNumber >= maxAttempts) {
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("run.interrupted entityId={} criterion={} run={}", entityId, criterion.key(), runNumber);
                break;
            }
            runNumber++;
        }

        if (!record.isSuccessful() && runNumber >= maxAttempts) {
            RunHistory finalHistory = store.history(entityId, criterion);
            log.warn("run.exhausted entityId={} criterion={} state={} emptyAttempts={} failedAttempts={}",
                    entityId, criterion.key(), finalHistory.state(maxAttempts),
                    finalHistory.emptyAttempts(), finalHistory.failedAttempts());
        }
        return record;
    }

    private RunRecord attempt(String entityId, Criterion criterion, int runNumber,
                              EvidenceFetchAdapter adapter, Duration timeout) {
        long start = System.nanoTime();
        RunRecord record = fetchAndRecord(entityId, criterion, runNumber, adapter, timeout);
        metrics.recordFetchDuration(criterion, record.status(), Duration.ofNanos(System.nanoTime() - start));
        return record;
    }

    private RunRecord fetchAndRecord(String entityId, Criterion criterion, int runNumber,
                                     EvidenceFetchAdapter adapter, Duration timeout) {
        List<EvidenceRecord> batch;
        try {
            batch = fetch(entityId, criterion, adapter, timeout);
        } catch (TimeoutException e) {
            log.warn("fetch.timeout entityId={} criterion={} run={} timeoutMs={}",
                    entityId, criterion.key(), runNumber, timeout.toMillis());
            return RunRecord.failed(entityId, criterion, runNumber,
                    "fetch timed out after " + timeout.toMillis() + "ms", 0, now());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RunRecord.failed(entityId, criterion, runNumber, "fetch interrupted", 0, now());
        } catch (EvidenceFetchException e) {
            log.warn("fetch.failed entityId={} criterion={} run={} error={}",
                    entityId, criterion.key(), runNumber, e.getMessage());
            return RunRecord.failed(entityId, criterion, runNumber, describe(e), 0, now());
        } catch (RuntimeException e) {
            log.error("fetch.error entityId={} criterion={} run={}", entityId, criterion.key(), runNumber, e);
            return RunRecord.failed(entityId, criterion, runNumber, describe(e), 0, now());
        }

        if (batch == null) {
            return RunRecord.failed(entityId, criterion, runNumber, "adapter returned no result", 0, now());
        }
        if (batch.isEmpty()) {
            return RunRecord.empty(entityId, criterion, runNumber, now());
        }

        EvidenceValidator.Result validated = validator.validate(entityId, criterion, batch);
        if (validated.allMalformed()) {
            return RunRecord.failed(entityId, criterion, runNumber,
                    "all " + validated.dropped() + " records malformed", validated.dropped(), now());
        }
        List<EvidenceRecord> scored = validated.valid().stream().map(scorer::scored).toList();
        return RunRecord.nonEmpty(entityId, criterion, runNumber, scored, validated.dropped(), now());
    }

    private List<EvidenceRecord> fetch(String entityId, Criterion criterion, EvidenceFetchAdapter adapter,
                                       Duration timeout) throws TimeoutException, InterruptedException {
        if (timeout == null) {
            return adapter.fetch(entityId, criterion);
        }
        Future<List<EvidenceRecord>> future = fetchExecutor.submit(() -> adapter.fetch(entityId, criterion));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new EvidenceFetchException("Fetch failed: " + cause, cause);
        }
    }

    private static String describe(RuntimeException e) {
        if (e instanceof EvidenceFetchException) {
            return e.getMessage();
        }
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }

    private Instant now() {
        return clock.instant();
    }

    static String lockKey(String entityId, Criterion criterion) {
        return entityId + ":" + criterion.key();
    }

    @Override
    public void close() {
        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EvidenceStore store;
        private KeyLock keyLock;
        private ReliabilityScorer scorer;
        private EvidenceValidator validator;
        private PipelineMetrics metrics;
        private Clock clock;
        private Duration defaultTimeout;

        public Builder store(EvidenceStore store) {
            this.store = store;
            return this;
        }

        public Builder keyLock(KeyLock keyLock) {
            this.keyLock = keyLock;
            return this;
        }

        public Builder scorer(ReliabilityScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder validator(EvidenceValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Timeout applied by {@link RunManager#process(String, Criterion, EvidenceFetchAdapter, int)};
         * null leaves fetches unbounded.
         */
        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public RunManager build() {
            return new RunManager(this);
        }
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "evidence-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
