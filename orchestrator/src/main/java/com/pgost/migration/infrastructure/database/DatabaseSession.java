package com.pgost.migration.infrastructure.database;

import com.pgost.migration.exception.AdvisoryLockLostException;
import com.pgost.migration.exception.DatabaseOperationException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * One dedicated connection with scoped transactions and advisory locking.
 * Each concurrent unit of a migration owns exactly one session; sessions are not thread-safe.
 * A connection that dies mid-transaction is discarded and reopened on next use. Advisory locks taken
 * through the session are taken again on the new connection; when another session got one first,
 * the reopen fails with {@link AdvisoryLockLostException}.
 */
@Slf4j
public class DatabaseSession implements AutoCloseable {
    
    private final Supplier<Connection> connectionSupplier;
    private final String name;
    private final Set<String> heldAdvisoryLocks = new LinkedHashSet<>();
    private Connection connection;
    
    public DatabaseSession(Supplier<Connection> connectionSupplier, String name) {
        this.connectionSupplier = connectionSupplier;
        this.name = name;
    }
    
    /**
     * Run the callback in a transaction: commit on success, roll back on any failure.
     */
    public <T> T inTransaction(TransactionCallback<T> callback) {
        Connection conn = connection();
        try {
            conn.setAutoCommit(false);
            T result = callback.doInTransaction(conn);
            conn.commit();
            return result;
            
        } catch (SQLException e) {
            rollbackAfterFailure(conn);
            throw SqlErrorClassifier.translate("Transaction failed on session '" + name + "'", e);
        } catch (RuntimeException e) {
            rollbackAfterFailure(conn);
            throw e;
        } finally {
            restoreAutoCommit(conn);
        }
    }
    
    /**
     * Run the callback outside an explicit transaction (autocommit).
     */
    public <T> T withConnection(TransactionCallback<T> callback) {
        Connection conn = connection();
        try {
            return callback.doInTransaction(conn);
        } catch (SQLException e) {
            discardIfBroken(conn);
            throw SqlErrorClassifier.translate("Statement failed on session '" + name + "'", e);
        }
    }
    
    /**
     * Execute a single statement in autocommit mode.
     */
    public void execute(String sql) {
        log.debug("[{}] Executing: {}", name, preview(sql));
        withConnection(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(sql);
            }
            return null;
        });
    }
    
    /**
     * Query a single nullable long value.
     */
    public Long queryForLong(String sql, Object... params) {
        return withConnection(conn -> queryForLong(conn, sql, params));
    }
    
    /**
     * Query a single boolean value; no row reads as false.
     */
    public boolean queryForBoolean(String sql, Object... params) {
        return withConnection(conn -> {
            try (PreparedStatement stmt = prepare(conn, sql, params);
                 ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        });
    }
    
    /**
     * Query a single nullable string value.
     */
    public String queryForString(String sql, Object... params) {
        return withConnection(conn -> {
            try (PreparedStatement stmt = prepare(conn, sql, params);
                 ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        });
    }
    
    /**
     * Try to take a session-level advisory lock keyed by the hash of the given text.
     */
    public boolean tryAdvisoryLock(String key) {
        boolean acquired = withConnection(conn -> tryAdvisoryLock(conn, key));
        if (acquired) {
            heldAdvisoryLocks.add(key);
        }
        return acquired;
    }
    
    /**
     * Touch the connection so a dead one is replaced and its advisory locks are taken again now rather
     * than on the next real statement.
     *
     * @throws AdvisoryLockLostException when a held lock now belongs to another session
     */
    public void verifyAdvisoryLocks() {
        if (heldAdvisoryLocks.isEmpty()) {
            return;
        }
        try {
            queryForBoolean("SELECT true");
        } catch (DatabaseOperationException e) {
            if (!e.isTransientFailure()) {
                throw e;
            }
            log.warn("[{}] Connection check failed ({}), reconnecting", name, e.getMessage());
            queryForBoolean("SELECT true");
        }
    }
    
    public void releaseAdvisoryLock(String key) {
        heldAdvisoryLocks.remove(key);
        if (connection == null) {
            return;
        }
        boolean released = queryForBoolean("SELECT pg_advisory_unlock(hashtext(?))", key);
        if (!released) {
            log.warn("[{}] Advisory lock '{}' was not held at release", name, key);
        }
    }
    
    @Override
    public void close() {
        heldAdvisoryLocks.clear();
        closeConnection();
    }
    
    private void closeConnection() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("[{}] Failed to close connection: {}", name, e.getMessage());
            }
            connection = null;
        }
    }
    
    static Long queryForLong(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement stmt = prepare(conn, sql, params);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                return null;
            }
            long value = rs.getLong(1);
            return rs.wasNull() ? null : value;
        }
    }
    
    static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        for (int i = 0; i < params.length; i++) {
            stmt.setObject(i + 1, params[i]);
        }
        return stmt;
    }
    
    private Connection connection() {
        try {
            if (connection == null || connection.isClosed()) {
                log.debug("[{}] Opening connection", name);
                Connection fresh = connectionSupplier.get();
                try {
                    reacquireAdvisoryLocks(fresh);
                } catch (SQLException | RuntimeException e) {
                    closeQuietly(fresh);
                    throw e;
                }
                connection = fresh;
            }
            return connection;
        } catch (SQLException e) {
            throw SqlErrorClassifier.translate("Connection check failed on session '" + name + "'", e);
        }
    }
    
    private void reacquireAdvisoryLocks(Connection conn) throws SQLException {
        Iterator<String> keys = heldAdvisoryLocks.iterator();
        while (keys.hasNext()) {
            String key = keys.next();
            if (!tryAdvisoryLock(conn, key)) {
                keys.remove();
                throw new AdvisoryLockLostException("Advisory lock '" + key + "' was released when the connection of session '"
                    + name + "' dropped, and another session holds it now");
            }
            log.warn("[{}] Re-acquired advisory lock '{}' on a new connection", name, key);
        }
    }
    
    private static boolean tryAdvisoryLock(Connection conn, String key) throws SQLException {
        try (PreparedStatement stmt = prepare(conn, "SELECT pg_try_advisory_lock(hashtext(?))", key);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() && rs.getBoolean(1);
        }
    }
    
    private void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.debug("[{}] Failed to close connection: {}", name, e.getMessage());
        }
    }
    
    private void rollbackAfterFailure(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("[{}] Rollback failed: {}", name, rollbackEx.getMessage());
        }
        discardIfBroken(conn);
    }
    
    private void restoreAutoCommit(Connection conn) {
        if (conn != connection) {
            return;
        }
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.debug("[{}] Could not restore autocommit: {}", name, e.getMessage());
            discardIfBroken(conn);
        }
    }
    
    private void discardIfBroken(Connection conn) {
        boolean valid;
        try {
            valid = conn.isValid(2);
        } catch (SQLException e) {
            valid = false;
        }
        if (!valid && conn == connection) {
            log.warn("[{}] Connection is no longer valid, it will be reopened", name);
            closeConnection();
        }
    }
    
    private static String preview(String sql) {
        return sql.length() > 200 ? sql.substring(0, 200) + "..." : sql;
    }
}
