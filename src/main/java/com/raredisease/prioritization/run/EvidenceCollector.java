package com.raredisease.prioritization.run;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.Disease;
import com.raredisease.prioritization.core.model.RunRecord;
import com.raredisease.prioritization.core.model.RunState;
import com.raredisease.prioritization.fetch.EvidenceFetchAdapter;
import com.raredisease.prioritization.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@link RunManager} for every (disease, criterion) key of a batch on a
 * fixed-size worker pool. The failure of one key never aborts the others.
 */
public class EvidenceCollector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EvidenceCollector.class);

    private final RunManager runManager;
    private final Map<Criterion, EvidenceFetchAdapter> adapters;
    private final int maxAttempts;
    private final int maxConcurrency;
    private final ExecutorService executor;

    public EvidenceCollector(RunManager runManager, Map<Criterion, EvidenceFetchAdapter> adapters,
                             int maxAttempts, int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        this.runManager = runManager;
        this.adapters = adapters.isEmpty() ? Map.of() : new EnumMap<>(adapters);
        this.maxAttempts = maxAttempts;
        this.maxConcurrency = maxConcurrency;
        this.executor = Executors.newFixedThreadPool(maxConcurrency);
    }

    /**
     * Collects evidence for every disease and every criterion that has an adapter.
     */
    public CollectionReport collect(Collection<Disease> diseases, Set<Criterion> criteria) {
        String batchId = LogContext.generateBatchId();
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forBatch(batchId)) {
            List<Criterion> collectable = new ArrayList<>();
            for (Criterion criterion : criteria) {
                if (adapters.containsKey(criterion)) {
                    collectable.add(criterion);
                } else {
                    log.warn("collect.adapter.missing criterion={}", criterion.key());
                }
            }
            log.info("collect.started batchId={} diseases={} criteria={} maxConcurrency={}",
                    batchId, diseases.size(), collectable.size(), maxConcurrency);

            Semaphore permits = new Semaphore(maxConcurrency);
            List<KeyTask> tasks = new ArrayList<>();
            for (Disease disease : diseases) {
                for (Criterion criterion : collectable) {
                    acquire(permits);
                    Future<RunRecord> future;
                    try {
                        future = executor.submit(() -> {
                            try {
                                return runManager.process(disease.getEntityId(), criterion,
                                        adapters.get(criterion), maxAttempts);
                            } finally {
                                permits.release();
                            }
                        });
                    } catch (RuntimeException e) {
                        permits.release();
                        throw e;
                    }
                    tasks.add(new KeyTask(disease.getEntityId(), criterion, future));
                }
            }

            int succeeded = 0;
            List<CollectionFailure> failures = new ArrayList<>();
            for (KeyTask task : tasks) {
                CollectionFailure failure = outcome(task);
                if (failure == null) {
                    succeeded++;
                } else {
                    failures.add(failure);
                }
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            log.info("collect.completed batchId={} keys={} succeeded={} failures={} durationMs={}",
                    batchId, tasks.size(), succeeded, failures.size(), duration.toMillis());
            return new CollectionReport(batchId, tasks.size(), succeeded, failures, duration);
        }
    }

    private CollectionFailure outcome(KeyTask task) {
        try {
            RunRecord record = task.future().get();
            if (record.isSuccessful()) {
                return null;
            }
            RunState state = runManager.state(task.entityId(), task.criterion(), maxAttempts);
            String reason = record.error() != null
                    ? record.error()
                    : "no evidence after " + record.runNumber() + " attempt(s)";
            return new CollectionFailure(task.entityId(), task.criterion(), state, reason);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.future().cancel(true);
            return new CollectionFailure(task.entityId(), task.criterion(),
                    runManager.state(task.entityId(), task.criterion(), maxAttempts), "collection interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("collect.key.failed entityId={} criterion={}", task.entityId(), task.criterion().key(), cause);
            return new CollectionFailure(task.entityId(), task.criterion(),
                    runManager.state(task.entityId(), task.criterion(), maxAttempts),
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private static void acquire(Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scheduling evidence collection", e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record KeyTask(String entityId, Criterion criterion, Future<RunRecord> future) {}
}
