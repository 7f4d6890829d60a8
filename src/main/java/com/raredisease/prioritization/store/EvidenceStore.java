package com.raredisease.prioritization.store;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.RunHistory;
import com.raredisease.prioritization.core.model.RunRecord;

import java.util.List;
import java.util.Optional;

/**
 * Document store for run histories and curated values.
 *
 * <p>Run records are keyed by (entity, criterion, run number) and are append-only.
 * Curated values are keyed by (entity, criterion); saving one supersedes the
 * previous value of the key.</p>
 */
public interface EvidenceStore {

    /**
     * Appends a run record.
     *
     * @throws RunSequenceException if the run number is not exactly one past the key's latest
     */
    RunRecord appendRun(RunRecord record);

    /**
     * All runs of a key in run-number order.
     */
    List<RunRecord> findRuns(String entityId, Criterion criterion);

    Optional<RunRecord> findRun(String entityId, Criterion criterion, int runNumber);

    default RunHistory history(String entityId, Criterion criterion) {
        return new RunHistory(entityId, criterion, findRuns(entityId, criterion));
    }

    default Optional<RunRecord> latestRun(String entityId, Criterion criterion) {
        return history(entityId, criterion).latest();
    }

    CuratedValue saveCuratedValue(CuratedValue value);

    Optional<CuratedValue> findCuratedValue(String entityId, Criterion criterion);

    /**
     * All curated values of a criterion across the corpus.
     */
    List<CuratedValue> findCuratedValues(Criterion criterion);

    List<CuratedValue> findAllCuratedValues();

    /**
     * Total number of run records stored.
     */
    int countRuns();
}
