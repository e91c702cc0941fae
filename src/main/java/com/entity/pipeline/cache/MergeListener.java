package com.entity.pipeline.cache;

/**
 * Listener for entity merge events. Implementations can react to merges,
 * e.g., by invalidating cache entries.
 */
public interface MergeListener {

    /**
     * Called after a merge has committed.
     *
     * @param sourceEntityId the entity that was merged away (now deleted)
     * @param targetEntityId the surviving canonical entity
     */
    void onMerge(long sourceEntityId, long targetEntityId);
}
