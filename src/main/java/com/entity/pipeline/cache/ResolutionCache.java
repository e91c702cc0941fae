package com.entity.pipeline.cache;

import com.entity.pipeline.core.model.EntityType;

import java.util.Optional;

/**
 * Cache of single-name resolutions, keyed by normalized name + entity type.
 */
public interface ResolutionCache {

    /**
     * Gets the cached entity id for a name.
     */
    Optional<Long> get(String normalizedName, EntityType entityType);

    /**
     * Caches the entity a name resolved to.
     */
    void put(String normalizedName, EntityType entityType, long entityId);

    /**
     * Invalidates all cache entries that resolve to the given entity.
     */
    void invalidate(long entityId);

    void invalidateAll();

    CacheStats getStats();
}
