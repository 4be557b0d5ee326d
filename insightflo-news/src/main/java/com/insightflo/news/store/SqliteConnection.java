package com.insightflo.news.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single SQLite connection of the local store.
 * All access is serialized on one lock; the JDBC connection is not shared unguarded.
 */
public class SqliteConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    private final Path dbPath;
    private Connection connection;
    private final Object lock = new Object();

    public SqliteConnection(Path dbPath) {
        this.dbPath = dbPath;
    }

    public Path getDbPath() {
        return dbPath;
    }

    /**
     * Run a read or single-statement write against the connection.
     */
    public <T> T query(TransactionFunction<T> function) throws SQLException {
        synchronized (lock) {
            return function.apply(getConnection());
        }
    }

    /**
     * Execute a function within a transaction.
     * Commits on success, rolls back on failure.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        synchronized (lock) {
            Connection conn = getConnection();
            boolean autoCommitOriginal = conn.getAutoCommit();
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(autoCommitOriginal);
                } catch (SQLException e) {
                    log.warn("Could not restore auto-commit: {}", e.getMessage());
                }
            }
        }
    }

    public void executeInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    private Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            connection = createConnection();
        }
        return connection;
    }

    private Connection createConnection() throws SQLException {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new SQLException("Cannot create database directory for " + dbPath, e);
        }

        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA foreign_keys=ON");
            stmt.execute("PRAGMA busy_timeout=30000");
            stmt.execute("PRAGMA cache_size=-16384");
        }
        log.debug("Created SQLite connection at {}", dbPath.toAbsolutePath());
        return conn;
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite connection at {}", dbPath);
                } catch (SQLException e) {
                    log.warn("Error closing connection at {}: {}", dbPath, e.getMessage());
                }
                connection = null;
            }
        }
    }

    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
