package com.entity.pipeline.cache;

import com.entity.pipeline.core.model.EntityType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed resolution cache with an entity id index for targeted invalidation.
 * Implements {@link MergeListener} so merges and deletions never leave a name resolving
 * to an entity that no longer exists.
 */
public class CaffeineResolutionCache implements ResolutionCache, MergeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CacheKey, Long> cache;
    // Secondary index: entityId -> set of cache keys resolving to that entity
    private final ConcurrentMap<Long, Set<CacheKey>> entityIndex = new ConcurrentHashMap<>();

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((CacheKey key, Long value, RemovalCause cause) -> {
                    if (key != null && value != null) {
                        removeFromIndex(key, value);
                    }
                })
                .build();
        log.info("CaffeineResolutionCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<Long> get(String normalizedName, EntityType entityType) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(normalizedName, entityType)));
    }

    @Override
    public void put(String normalizedName, EntityType entityType, long entityId) {
        CacheKey key = new CacheKey(normalizedName, entityType);
        cache.put(key, entityId);
        entityIndex.computeIfAbsent(entityId, k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidate(long entityId) {
        Set<CacheKey> keys = entityIndex.remove(entityId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cache entries for entity {}", keys.size(), entityId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        entityIndex.clear();
        log.debug("Invalidated all cache entries");
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

    @Override
    public void onMerge(long sourceEntityId, long targetEntityId) {
        invalidate(sourceEntityId);
        invalidate(targetEntityId);
        log.debug("Cache invalidated for merge: {} -> {}", sourceEntityId, targetEntityId);
    }

    private void removeFromIndex(CacheKey key, long entityId) {
        Set<CacheKey> keys = entityIndex.get(entityId);
        if (keys != null) {
            keys.remove(key);
        }
    }

    /**
     * Cache key combining normalized name and entity type.
     */
    record CacheKey(String normalizedName, EntityType entityType) {}
}
