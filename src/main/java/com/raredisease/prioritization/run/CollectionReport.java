package com.raredisease.prioritization.run;

import com.raredisease.prioritization.core.model.RunState;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one collection pass over a batch of (disease, criterion) keys.
 *
 * @param batchId    id of the pass, also put on the MDC
 * @param totalKeys  number of keys processed
 * @param succeeded  number of keys holding evidence after the pass
 * @param failures   every key without evidence, with the reason
 * @param duration   wall-clock time of the pass
 */
public record CollectionReport(
        String batchId,
        int totalKeys,
        int succeeded,
        List<CollectionFailure> failures,
        Duration duration
) {
    public CollectionReport {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public List<CollectionFailure> exhaustedEmpty() {
        return failures.stream().filter(f -> f.state() == RunState.EXHAUSTED_EMPTY).toList();
    }

    public List<CollectionFailure> exhaustedFailed() {
        return failures.stream().filter(f -> f.state() == RunState.EXHAUSTED_FAILED).toList();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
