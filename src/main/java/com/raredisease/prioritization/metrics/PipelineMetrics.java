package com.raredisease.prioritization.metrics;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.RunStatus;
import com.raredisease.prioritization.core.model.SelectionMethod;

import java.time.Duration;

/**
 * Records prioritization pipeline metrics.
 * The default {@link NoOpPipelineMetrics} does nothing, so the library works
 * without any metrics backend on the classpath.
 */
public interface PipelineMetrics {

    void recordFetchDuration(Criterion criterion, RunStatus status, Duration duration);

    void incrementRun(Criterion criterion, RunStatus status);

    void recordDroppedRecords(Criterion criterion, int count);

    void incrementCuration(Criterion criterion, SelectionMethod method);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
