package com.entity.pipeline.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite implementation of {@link StoreConnection} over a single JDBC connection.
 * Foreign keys are enforced; file databases use write-ahead logging.
 */
public class SqliteStoreConnection implements StoreConnection {
    private static final Logger log = LoggerFactory.getLogger(SqliteStoreConnection.class);

    public static final String IN_MEMORY = ":memory:";
    private static final String SCHEMA_RESOURCE = "/schema.sql";

    private final Connection connection;
    private final String databasePath;
    private boolean inTransaction;

    private final ReentrantLock unitOfWorkLock = new ReentrantLock();

    public SqliteStoreConnection(String databasePath) {
        this(databasePath, 30_000);
    }

    public SqliteStoreConnection(String databasePath, int busyTimeoutMs) {
        this.databasePath = databasePath;
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMs);
        if (!IN_MEMORY.equals(databasePath)) {
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
            config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        }
        try {
            this.connection = config.createConnection("jdbc:sqlite:" + databasePath);
        } catch (SQLException e) {
            throw new StoreException("Cannot open database " + databasePath + ": " + e.getMessage(), e);
        }
        log.info("store.opened path={}", databasePath);
    }

    /**
     * Opens a fresh in-memory database with the schema applied.
     */
    public static SqliteStoreConnection inMemory() {
        SqliteStoreConnection store = new SqliteStoreConnection(IN_MEMORY);
        store.createSchema();
        return store;
    }

    @Override
    public int execute(String sql, Map<String, Object> params) {
        NamedParameterSql parsed = NamedParameterSql.parse(sql);
        try (PreparedStatement statement = prepare(parsed, params)) {
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Statement failed: " + e.getMessage() + " [" + firstLine(sql) + "]", e);
        }
    }

    @Override
    public List<Map<String, Object>> query(String sql, Map<String, Object> params) {
        NamedParameterSql parsed = NamedParameterSql.parse(sql);
        try (PreparedStatement statement = prepare(parsed, params);
             ResultSet rs = statement.executeQuery()) {
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i), rs.getObject(i));
                }
                rows.add(row);
            }
            log.trace("Query returned {} rows", rows.size());
            return rows;
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + e.getMessage() + " [" + firstLine(sql) + "]", e);
        }
    }

    @Override
    public long insert(String sql, Map<String, Object> params) {
        execute(sql, params);
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : -1L;
        } catch (SQLException e) {
            throw new StoreException("Cannot read inserted rowid: " + e.getMessage(), e);
        }
    }

    @Override
    public ReentrantLock unitOfWorkLock() {
        return unitOfWorkLock;
    }

    @Override
    public void begin() {
        if (inTransaction) {
            throw new StoreException("Transaction already active on " + databasePath);
        }
        try {
            connection.setAutoCommit(false);
            inTransaction = true;
        } catch (SQLException e) {
            throw new StoreException("Cannot begin transaction: " + e.getMessage(), e);
        }
    }

    @Override
    public void commit() {
        if (!inTransaction) {
            throw new StoreException("No active transaction to commit");
        }
        try {
            connection.commit();
            connection.setAutoCommit(true);
            inTransaction = false;
        } catch (SQLException e) {
            // left open so that the caller's rollback can discard it
            throw new StoreException("Commit failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void rollback() {
        if (!inTransaction) {
            return;
        }
        try {
            connection.rollback();
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw new StoreException("Rollback failed: " + e.getMessage(), e);
        } finally {
            inTransaction = false;
        }
    }

    @Override
    public boolean isInTransaction() {
        return inTransaction;
    }

    @Override
    public boolean isConnected() {
        try {
            return !connection.isClosed() && connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getDatabasePath() {
        return databasePath;
    }

    @Override
    public void createSchema() {
        log.info("Creating schema for {}", databasePath);
        for (String statement : loadSchemaStatements()) {
            execute(statement);
        }
        log.info("Schema creation complete");
    }

    @Override
    public void close() {
        try {
            if (inTransaction) {
                log.warn("Closing store with an open transaction, rolling back");
                rollback();
            }
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing SQLite connection", e);
        }
        log.info("store.closed path={}", databasePath);
    }

    private PreparedStatement prepare(NamedParameterSql parsed, Map<String, Object> params) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(parsed.sql());
        try {
            List<Object> values = parsed.bind(params);
            for (int i = 0; i < values.size(); i++) {
                statement.setObject(i + 1, toSqlValue(values.get(i)));
            }
            return statement;
        } catch (SQLException | RuntimeException e) {
            statement.close();
            throw e;
        }
    }

    private static Object toSqlValue(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        return value;
    }

    static List<String> loadSchemaStatements() {
        try (InputStream in = SqliteStoreConnection.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new StoreException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            String script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            StringBuilder withoutComments = new StringBuilder();
            for (String line : script.split("\n")) {
                if (!line.trim().startsWith("--")) {
                    withoutComments.append(line).append('\n');
                }
            }
            List<String> statements = new ArrayList<>();
            for (String statement : withoutComments.toString().split(";\\s*\n")) {
                if (!statement.isBlank()) {
                    statements.add(statement.trim());
                }
            }
            return statements;
        } catch (IOException e) {
            throw new StoreException("Cannot read schema resource: " + e.getMessage(), e);
        }
    }

    private static String firstLine(String sql) {
        String trimmed = sql.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline).strip() + " ...";
    }
}
