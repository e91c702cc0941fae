package com.entity.pipeline.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process entity lock using one {@link ReentrantLock} per entity id.
 */
public class LocalEntityLock implements EntityLock {
    private static final Logger log = LoggerFactory.getLogger(LocalEntityLock.class);

    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalEntityLock() {
        this(LockConfig.defaults());
    }

    public LocalEntityLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(long entityId) {
        ReentrantLock lock = locks.computeIfAbsent(entityId, k -> new ReentrantLock());
        try {
            boolean acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for entity " + entityId + " within " + config.timeoutMs() + "ms");
            }
            log.debug("Lock acquired: entity {}", entityId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for entity " + entityId, e);
        }
    }

    @Override
    public void unlock(long entityId) {
        ReentrantLock lock = locks.get(entityId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Lock released: entity {}", entityId);
        }
    }

    boolean isLocked(long entityId) {
        ReentrantLock lock = locks.get(entityId);
        return lock != null && lock.isLocked();
    }
}
