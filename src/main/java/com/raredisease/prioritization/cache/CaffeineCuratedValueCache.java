package com.raredisease.prioritization.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed curated-value cache, bounded by size and expiring after write.
 */
public class CaffeineCuratedValueCache implements CuratedValueCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCuratedValueCache.class);

    private final Cache<CacheKey, CuratedValue> cache;

    public CaffeineCuratedValueCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    /**
     * Builds the cache the configuration asks for: Caffeine when enabled, a no-op otherwise.
     */
    public static CuratedValueCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineCuratedValueCache(config) : new NoOpCuratedValueCache();
    }

    @Override
    public Optional<CuratedValue> get(String entityId, Criterion criterion) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(entityId, criterion)));
    }

    @Override
    public void put(CuratedValue value) {
        cache.put(new CacheKey(value.getEntityId(), value.getCriterion()), value);
    }

    @Override
    public void invalidate(String entityId) {
        List<CacheKey> keys = cache.asMap().keySet().stream()
                .filter(k -> k.entityId().equals(entityId))
                .toList();
        cache.invalidateAll(keys);
        log.debug("cache.invalidated entityId={} entries={}", entityId, keys.size());
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated.all");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(String entityId, Criterion criterion) {}
}
