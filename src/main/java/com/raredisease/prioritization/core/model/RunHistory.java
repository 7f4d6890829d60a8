package com.raredisease.prioritization.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered run history of one (disease, criterion) key with the state derived from it.
 */
public record RunHistory(String entityId, Criterion criterion, List<RunRecord> runs) {

    public RunHistory {
        runs = runs != null
                ? runs.stream().sorted(Comparator.comparingInt(RunRecord::runNumber)).toList()
                : List.of();
    }

    public int size() {
        return runs.size();
    }

    public int nextRunNumber() {
        return runs.isEmpty() ? 1 : runs.get(runs.size() - 1).runNumber() + 1;
    }

    public Optional<RunRecord> latest() {
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(runs.size() - 1));
    }

    /**
     * The active run: the latest non-empty success, or the latest record if none succeeded.
     */
    public Optional<RunRecord> active() {
        for (int i = runs.size() - 1; i >= 0; i--) {
            if (runs.get(i).isSuccessful()) {
                return Optional.of(runs.get(i));
            }
        }
        return latest();
    }

    public long emptyAttempts() {
        return runs.stream().filter(r -> r.status() == RunStatus.SUCCESS_EMPTY).count();
    }

    public long failedAttempts() {
        return runs.stream().filter(r -> r.status() == RunStatus.FAILED).count();
    }

    /**
     * Derives the key's state given the attempt budget.
     */
    public RunState state(int maxAttempts) {
        Optional<RunRecord> latest = latest();
        if (latest.isEmpty()) {
            return RunState.NOT_STARTED;
        }
        RunRecord last = latest.get();
        if (last.isSuccessful()) {
            return RunState.SUCCEEDED;
        }
        if (runs.size() < maxAttempts) {
            return RunState.PENDING;
        }
        return last.status() == RunStatus.SUCCESS_EMPTY
                ? RunState.EXHAUSTED_EMPTY
                : RunState.EXHAUSTED_FAILED;
    }
}
