package com.entity.pipeline.lock;

import java.util.Arrays;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-entity lock serializing merges that touch overlapping entity ids.
 */
public interface EntityLock {

    /**
     * Acquires the lock for an entity.
     *
     * @param entityId the entity id
     * @throws LockAcquisitionException if the lock is not acquired within the configured timeout
     */
    void lock(long entityId);

    /**
     * Releases the lock for an entity. No-op if the current thread does not hold it.
     *
     * @param entityId the entity id
     */
    void unlock(long entityId);

    /**
     * Acquires the locks of several entities in ascending id order, so two callers locking
     * overlapping sets cannot deadlock. Locks already taken are released if a later one fails.
     */
    default Held lockAll(long... entityIds) {
        long[] ordered = Arrays.stream(entityIds).distinct().sorted().toArray();
        List<Long> acquired = new ArrayList<>(ordered.length);
        try {
            for (long id : ordered) {
                lock(id);
                acquired.add(id);
            }
        } catch (RuntimeException e) {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                unlock(acquired.get(i));
            }
            throw e;
        }
        return () -> {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                unlock(acquired.get(i));
            }
        };
    }

    /**
     * Set of held locks, released on close.
     */
    @FunctionalInterface
    interface Held extends AutoCloseable {
        @Override
        void close();
    }
}
