package com.raredisease.prioritization.metrics;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.RunStatus;
import com.raredisease.prioritization.core.model.SelectionMethod;

import java.time.Duration;

/**
 * Metrics sink that discards everything.
 */
public class NoOpPipelineMetrics implements PipelineMetrics {

    public static final NoOpPipelineMetrics INSTANCE = new NoOpPipelineMetrics();

    @Override
    public void recordFetchDuration(Criterion criterion, RunStatus status, Duration duration) {
    }

    @Override
    public void incrementRun(Criterion criterion, RunStatus status) {
    }

    @Override
    public void recordDroppedRecords(Criterion criterion, int count) {
    }

    @Override
    public void incrementCuration(Criterion criterion, SelectionMethod method) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
