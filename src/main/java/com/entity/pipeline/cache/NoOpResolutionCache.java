package com.entity.pipeline.cache;

import com.entity.pipeline.core.model.EntityType;

import java.util.Optional;

/**
 * Resolution cache that stores nothing, used when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache, MergeListener {

    @Override
    public Optional<Long> get(String normalizedName, EntityType entityType) {
        return Optional.empty();
    }

    @Override
    public void put(String normalizedName, EntityType entityType, long entityId) {
    }

    @Override
    public void invalidate(long entityId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }

    @Override
    public void onMerge(long sourceEntityId, long targetEntityId) {
    }
}
