package com.raredisease.prioritization.cache;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;

import java.util.Optional;

/**
 * Cache of curated values keyed by disease id + criterion.
 * Entries may be evicted at any time; the store remains the source of truth.
 */
public interface CuratedValueCache {

    /**
     * Gets a cached curated value.
     *
     * @param entityId  the disease id
     * @param criterion the criterion
     * @return the cached value, or empty if not cached
     */
    Optional<CuratedValue> get(String entityId, Criterion criterion);

    void put(CuratedValue value);

    /**
     * Invalidates every criterion cached for the given disease.
     */
    void invalidate(String entityId);

    void invalidateAll();

    CacheStats getStats();
}
