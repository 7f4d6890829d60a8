package com.raredisease.prioritization.metrics;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.RunStatus;
import com.raredisease.prioritization.core.model.SelectionMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link PipelineMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code prioritization.fetch.duration} Timer (tags: criterion, status)</li>
 *   <li>{@code prioritization.runs} Counter (tags: criterion, status)</li>
 *   <li>{@code prioritization.records.dropped} Counter (tag: criterion)</li>
 *   <li>{@code prioritization.curations} Counter (tags: criterion, method)</li>
 *   <li>{@code prioritization.batch.size} DistributionSummary</li>
 *   <li>{@code prioritization.cache.hit} / {@code prioritization.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerPipelineMetrics implements PipelineMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerPipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("prioritization.batch.size")
                .description("Number of diseases per prioritization batch")
                .register(registry);
        this.cacheHitCounter = Counter.builder("prioritization.cache.hit")
                .description("Number of curated-value cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("prioritization.cache.miss")
                .description("Number of curated-value cache misses")
                .register(registry);
    }

    @Override
    public void recordFetchDuration(Criterion criterion, RunStatus status, Duration duration) {
        String key = criterion.key() + ":" + status.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("prioritization.fetch.duration")
                        .description("Duration of evidence fetch attempts")
                        .tag("criterion", criterion.key())
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRun(Criterion criterion, RunStatus status) {
        counter("runs:" + criterion.key() + ":" + status.name(), "prioritization.runs",
                "Number of run records written", "criterion", criterion.key(), "status", status.name())
                .increment();
    }

    @Override
    public void recordDroppedRecords(Criterion criterion, int count) {
        if (count <= 0) {
            return;
        }
        counter("dropped:" + criterion.key(), "prioritization.records.dropped",
                "Number of malformed evidence records dropped", "criterion", criterion.key())
                .increment(count);
    }

    @Override
    public void incrementCuration(Criterion criterion, SelectionMethod method) {
        counter("curation:" + criterion.key() + ":" + method.name(), "prioritization.curations",
                "Number of curated values by selection method",
                "criterion", criterion.key(), "method", method.name())
                .increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String cacheKey, String name, String description, String... tags) {
        return counterCache.computeIfAbsent(cacheKey, k ->
                Counter.builder(name)
                        .description(description)
                        .tags(tags)
                        .register(registry));
    }
}
