package com.entity.pipeline.store;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session over the pipeline's embedded database.
 * One instance is opened per run and passed to every component; tests substitute an
 * in-memory store or a decorator.
 *
 * <p>SQL uses named parameters ({@code :name}) bound from the parameter map.</p>
 */
public interface StoreConnection extends AutoCloseable {

    /**
     * Executes a statement that modifies the database.
     *
     * @param sql    the SQL statement
     * @param params named parameters
     * @return number of affected rows
     */
    int execute(String sql, Map<String, Object> params);

    /**
     * Executes a statement without parameters.
     */
    default int execute(String sql) {
        return execute(sql, Map.of());
    }

    /**
     * Executes a query and returns the rows, keyed by column label.
     *
     * @param sql    the SQL query
     * @param params named parameters
     * @return result rows
     */
    List<Map<String, Object>> query(String sql, Map<String, Object> params);

    /**
     * Executes a query without parameters.
     */
    default List<Map<String, Object>> query(String sql) {
        return query(sql, Map.of());
    }

    /**
     * Executes an INSERT and returns the rowid of the inserted row.
     */
    long insert(String sql, Map<String, Object> params);

    /**
     * Starts a transaction. Fails if one is already active.
     */
    void begin();

    /**
     * Commits the active transaction.
     */
    void commit();

    /**
     * Rolls back the active transaction. No-op when none is active.
     */
    void rollback();

    /**
     * Whether a transaction is currently active on this connection.
     */
    boolean isInTransaction();

    /**
     * Lock held by the thread that owns the active unit of work. Units of work on one
     * connection share a single JDBC transaction, so threads take turns; nested units on
     * the owning thread re-enter it.
     */
    ReentrantLock unitOfWorkLock();

    /**
     * Checks if the connection is alive.
     */
    boolean isConnected();

    /**
     * Location of the database, {@code :memory:} for in-memory stores.
     */
    String getDatabasePath();

    /**
     * Creates tables and indexes if they don't exist.
     */
    void createSchema();

    @Override
    void close();
}
