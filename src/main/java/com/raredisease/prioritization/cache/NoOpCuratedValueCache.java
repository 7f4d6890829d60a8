package com.raredisease.prioritization.cache;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;

import java.util.Optional;

/**
 * Cache that never holds anything. Used when caching is disabled.
 */
public class NoOpCuratedValueCache implements CuratedValueCache {

    @Override
    public Optional<CuratedValue> get(String entityId, Criterion criterion) {
        return Optional.empty();
    }

    @Override
    public void put(CuratedValue value) {
        // no-op
    }

    @Override
    public void invalidate(String entityId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
