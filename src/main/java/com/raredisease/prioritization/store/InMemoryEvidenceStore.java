package com.raredisease.prioritization.store;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.RunRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link EvidenceStore}.
 * Each key owns its own run list, so appends to different keys never contend.
 */
public class InMemoryEvidenceStore implements EvidenceStore {

    private final ConcurrentMap<StoreKey, List<RunRecord>> runs = new ConcurrentHashMap<>();
    private final ConcurrentMap<StoreKey, CuratedValue> curated = new ConcurrentHashMap<>();

    @Override
    public RunRecord appendRun(RunRecord record) {
        StoreKey key = new StoreKey(record.entityId(), record.criterion());
        List<RunRecord> history = runs.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>());
        synchronized (history) {
            int expected = history.size() + 1;
            if (record.runNumber() != expected) {
                throw new RunSequenceException("Run " + record.runNumber() + " for " + key
                        + " breaks the sequence, expected run " + expected);
            }
            history.add(record);
        }
        return record;
    }

    @Override
    public List<RunRecord> findRuns(String entityId, Criterion criterion) {
        List<RunRecord> history = runs.get(new StoreKey(entityId, criterion));
        return history != null ? Collections.unmodifiableList(new ArrayList<>(history)) : List.of();
    }

    @Override
    public Optional<RunRecord> findRun(String entityId, Criterion criterion, int runNumber) {
        return findRuns(entityId, criterion).stream()
                .filter(r -> r.runNumber() == runNumber)
                .findFirst();
    }

    @Override
    public CuratedValue saveCuratedValue(CuratedValue value) {
        curated.put(new StoreKey(value.getEntityId(), value.getCriterion()), value);
        return value;
    }

    @Override
    public Optional<CuratedValue> findCuratedValue(String entityId, Criterion criterion) {
        return Optional.ofNullable(curated.get(new StoreKey(entityId, criterion)));
    }

    @Override
    public List<CuratedValue> findCuratedValues(Criterion criterion) {
        return curated.values().stream()
                .filter(v -> v.getCriterion() == criterion)
                .collect(Collectors.toList());
    }

    @Override
    public List<CuratedValue> findAllCuratedValues() {
        return List.copyOf(curated.values());
    }

    @Override
    public int countRuns() {
        return runs.values().stream().mapToInt(List::size).sum();
    }

    record StoreKey(String entityId, Criterion criterion) {
        @Override
        public String toString() {
            return entityId + ":" + criterion.key();
        }
    }
}
