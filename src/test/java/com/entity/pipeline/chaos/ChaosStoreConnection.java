package com.entity.pipeline.chaos;

import com.entity.pipeline.store.StoreConnection;
import com.entity.pipeline.store.StoreException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decorator around a {@link StoreConnection} that injects configurable failures
 * for resilience testing: failing statements, failing queries, failing commits,
 * failures after a number of successful operations (globally or on one thread) and a
 * pause point for interleaving threads.
 */
public class ChaosStoreConnection implements StoreConnection {

    private final StoreConnection delegate;
    private final AtomicBoolean failOnExecute = new AtomicBoolean(false);
    private final AtomicBoolean failOnQuery = new AtomicBoolean(false);
    private final AtomicBoolean failOnCommit = new AtomicBoolean(false);
    private final AtomicBoolean simulateDisconnect = new AtomicBoolean(false);
    private final AtomicInteger failAfterNOperations = new AtomicInteger(-1);
    private final AtomicInteger operationCount = new AtomicInteger(0);
    private final AtomicInteger commits = new AtomicInteger(0);
    private final AtomicInteger rollbacks = new AtomicInteger(0);
    private volatile Thread failingThread;
    private final AtomicInteger failingThreadBudget = new AtomicInteger(-1);
    private volatile Thread pausedThread;
    private volatile CountDownLatch pauseReached;
    private volatile CountDownLatch pauseRelease;

    public ChaosStoreConnection(StoreConnection delegate) {
        this.delegate = delegate;
    }

    /**
     * When enabled, all execute() and insert() calls throw StoreException.
     */
    public void setFailOnExecute(boolean fail) {
        failOnExecute.set(fail);
    }

    /**
     * When enabled, all query() calls throw StoreException.
     */
    public void setFailOnQuery(boolean fail) {
        failOnQuery.set(fail);
    }

    /**
     * When enabled, commit() throws StoreException and leaves the transaction open.
     */
    public void setFailOnCommit(boolean fail) {
        failOnCommit.set(fail);
    }

    public void setSimulateDisconnect(boolean disconnected) {
        simulateDisconnect.set(disconnected);
    }

    /**
     * Configures the connection to fail after N successful operations.
     * Set to -1 to disable.
     */
    public void setFailAfterNOperations(int n) {
        failAfterNOperations.set(n);
        operationCount.set(0);
    }

    /**
     * Fails operations issued by {@code thread} once it has completed {@code n} of them.
     * Other threads are unaffected.
     */
    public void failThreadAfterNOperations(Thread thread, int n) {
        failingThreadBudget.set(n);
        failingThread = thread;
    }

    /**
     * Parks {@code thread} on its first execute() or insert(): counts down {@code reached},
     * then waits for {@code release} before running the statement.
     */
    public void pauseOnFirstWrite(Thread thread, CountDownLatch reached, CountDownLatch release) {
        pauseReached = reached;
        pauseRelease = release;
        pausedThread = thread;
    }

    public int getCommitCount() {
        return commits.get();
    }

    public int getRollbackCount() {
        return rollbacks.get();
    }

    /**
     * Resets all failure modes to normal behavior.
     */
    public void reset() {
        failOnExecute.set(false);
        failOnQuery.set(false);
        failOnCommit.set(false);
        simulateDisconnect.set(false);
        failAfterNOperations.set(-1);
        operationCount.set(0);
        failingThread = null;
        pausedThread = null;
    }

    @Override
    public int execute(String sql, Map<String, Object> params) {
        pauseIfRequested();
        checkOperationLimit();
        if (failOnExecute.get()) {
            throw new StoreException("ChaosStoreConnection: simulated execute failure");
        }
        return delegate.execute(sql, params);
    }

    @Override
    public List<Map<String, Object>> query(String sql, Map<String, Object> params) {
        checkOperationLimit();
        if (failOnQuery.get()) {
            throw new StoreException("ChaosStoreConnection: simulated query failure");
        }
        return delegate.query(sql, params);
    }

    @Override
    public long insert(String sql, Map<String, Object> params) {
        pauseIfRequested();
        checkOperationLimit();
        if (failOnExecute.get()) {
            throw new StoreException("ChaosStoreConnection: simulated insert failure");
        }
        return delegate.insert(sql, params);
    }

    @Override
    public void begin() {
        delegate.begin();
    }

    @Override
    public void commit() {
        if (failOnCommit.get()) {
            throw new StoreException("ChaosStoreConnection: simulated commit failure");
        }
        delegate.commit();
        commits.incrementAndGet();
    }

    @Override
    public void rollback() {
        rollbacks.incrementAndGet();
        delegate.rollback();
    }

    @Override
    public ReentrantLock unitOfWorkLock() {
        return delegate.unitOfWorkLock();
    }

    @Override
    public boolean isInTransaction() {
        return delegate.isInTransaction();
    }

    @Override
    public boolean isConnected() {
        if (simulateDisconnect.get()) {
            return false;
        }
        return delegate.isConnected();
    }

    @Override
    public String getDatabasePath() {
        return delegate.getDatabasePath();
    }

    @Override
    public void createSchema() {
        delegate.createSchema();
    }

    @Override
    public void close() {
        delegate.close();
    }

    private void pauseIfRequested() {
        if (pausedThread != Thread.currentThread()) {
            return;
        }
        pausedThread = null;
        pauseReached.countDown();
        try {
            if (!pauseRelease.await(10, TimeUnit.SECONDS)) {
                throw new StoreException("ChaosStoreConnection: pause was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("ChaosStoreConnection: interrupted while paused", e);
        }
    }

    private void checkOperationLimit() {
        if (failingThread == Thread.currentThread() && failingThreadBudget.getAndDecrement() <= 0) {
            throw new StoreException("ChaosStoreConnection: simulated failure on thread "
                    + Thread.currentThread().getName());
        }
        int limit = failAfterNOperations.get();
        if (limit >= 0) {
            int count = operationCount.incrementAndGet();
            if (count > limit) {
                throw new StoreException(
                        "ChaosStoreConnection: operation limit exceeded (" + count + " > " + limit + ")");
            }
        }
    }
}
