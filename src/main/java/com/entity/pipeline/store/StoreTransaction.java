package com.entity.pipeline.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * All-or-nothing unit of work over a {@link StoreConnection}.
 * The database transaction commits only when {@link #markSuccess()} was called and the
 * unit is not a dry run; otherwise {@link #close()} rolls it back. Compensations registered
 * for non-database side effects run in reverse order on rollback.
 *
 * <p>Usage:</p>
 * <pre>
 * try (StoreTransaction tx = StoreTransaction.begin(store, "merge 12 into 7")) {
 *     tx.execute("re-point mentions", () -&gt; mentions.reassign(12, 7));
 *     tx.execute("delete source", () -&gt; entities.delete(12));
 *     tx.markSuccess();
 * }
 * </pre>
 *
 * <p>A unit begun while another is active on the same connection and thread joins it: the
 * outer unit decides whether to commit. A unit begun on another thread waits on
 * {@link StoreConnection#unitOfWorkLock()} until the active one has closed.</p>
 */
public class StoreTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreTransaction.class);

    private final StoreConnection store;
    private final String description;
    private final boolean dryRun;
    private final boolean joined;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;
    private boolean rolledBack = false;

    private StoreTransaction(StoreConnection store, String description, boolean dryRun) {
        this.store = store;
        this.description = description;
        this.dryRun = dryRun;
        store.unitOfWorkLock().lock();
        try {
            this.joined = store.isInTransaction();
            if (!joined) {
                store.begin();
            }
        } catch (RuntimeException e) {
            store.unitOfWorkLock().unlock();
            throw e;
        }
    }

    public static StoreTransaction begin(StoreConnection store, String description) {
        return new StoreTransaction(store, description, false);
    }

    /**
     * Begins a unit that always rolls back, for computing and reporting without committing.
     */
    public static StoreTransaction begin(StoreConnection store, String description, boolean dryRun) {
        return new StoreTransaction(store, description, dryRun);
    }

    /**
     * Outer unit of a dry run. Units begun inside it join it, so later batches see the
     * effects of earlier ones, and everything is rolled back when it closes.
     *
     * @return null when {@code dryRun} is false; try-with-resources skips a null resource
     */
    public static StoreTransaction dryRunScope(StoreConnection store, String description, boolean dryRun) {
        if (!dryRun) {
            return null;
        }
        StoreTransaction scope = new StoreTransaction(store, description, true);
        scope.markSuccess();
        return scope;
    }

    /**
     * Runs {@code work} in its own unit and returns its result, committing on normal return.
     */
    public static <T> T inTransaction(StoreConnection store, String description, boolean dryRun,
                                      Supplier<T> work) {
        try (StoreTransaction tx = begin(store, description, dryRun)) {
            T result = work.get();
            tx.markSuccess();
            return result;
        }
    }

    /**
     * Executes one database step of the unit.
     * If the step fails, the whole unit is rolled back and the exception rethrown.
     *
     * @param stepDescription human-readable description of the step
     * @param operation       the operation to perform
     */
    public void execute(String stepDescription, Runnable operation) {
        execute(stepDescription, operation, null);
    }

    /**
     * Executes a step and registers a compensation for effects outside the database.
     *
     * @param stepDescription human-readable description of the step
     * @param operation       the operation to perform
     * @param compensation    action reversing non-database effects, may be null
     */
    public void execute(String stepDescription, Runnable operation, Runnable compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        if (rolledBack) {
            throw new IllegalStateException("Transaction '" + description + "' was rolled back");
        }
        try {
            log.debug("Executing step: {}", stepDescription);
            operation.run();
            if (compensation != null) {
                compensationStack.push(new CompensatingAction(stepDescription, compensation));
            }
        } catch (RuntimeException e) {
            log.warn("Step '{}' of '{}' failed: {}. Rolling back.", stepDescription, description, e.getMessage());
            rollback();
            throw e;
        }
    }

    /**
     * Marks the unit as successful. If called before close(), the unit commits.
     */
    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            finish();
        } finally {
            store.unitOfWorkLock().unlock();
        }
    }

    private void finish() {
        if (joined) {
            if (!success) {
                // the exception propagating to the owner of the outer unit rolls it back
                runCompensations();
            }
            return;
        }
        if (success && !dryRun) {
            try {
                store.commit();
                log.debug("Committed '{}'", description);
            } catch (RuntimeException e) {
                log.error("Commit of '{}' failed: {}", description, e.getMessage());
                rollback();
                throw e;
            }
        } else {
            if (!success) {
                log.warn("Transaction '{}' closed without success, rolling back", description);
            } else {
                log.debug("Dry run, rolling back '{}'", description);
            }
            rollback();
        }
    }

    private void rollback() {
        rolledBack = true;
        if (!joined) {
            try {
                store.rollback();
            } catch (RuntimeException e) {
                log.error("Rollback of '{}' failed: {}", description, e.getMessage());
            }
        }
        runCompensations();
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("Running compensation: {}", action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                log.error("Compensation '{}' failed (best-effort): {}", action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
