package com.pgost.migration.infrastructure.database;

import com.pgost.migration.exception.DatabaseOperationException;

import java.sql.SQLException;
import java.util.Set;

/**
 * Maps PostgreSQL SQLStates onto the retry policy: connection loss, deadlocks,
 * serialization failures and lock timeouts are transient, everything else is not.
 */
public final class SqlErrorClassifier {
    
    private static final Set<String> TRANSIENT_STATES = Set.of(
        "40001", // serialization_failure
        "40P01", // deadlock_detected
        "55P03", // lock_not_available
        "57P01", // admin_shutdown
        "53300"  // too_many_connections
    );
    
    private SqlErrorClassifier() {
        // Utility class - prevent instantiation
    }
    
    public static boolean isTransient(String sqlState) {
        if (sqlState == null) {
            return false;
        }
        return sqlState.startsWith("08") || TRANSIENT_STATES.contains(sqlState);
    }
    
    /**
     * Walk the cause chain and decide whether the failure is worth retrying.
     */
    public static boolean isTransient(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof DatabaseOperationException dbException) {
                return dbException.isTransientFailure();
            }
            if (cursor instanceof SQLException sqlException) {
                return isTransient(sqlException.getSQLState());
            }
            cursor = cursor.getCause();
        }
        return false;
    }
    
    /**
     * Whether the failure is an integrity constraint violation (SQLState class 23): unique, check,
     * not-null, foreign-key or exclusion.
     */
    public static boolean isConstraintViolation(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            String sqlState = null;
            if (cursor instanceof DatabaseOperationException dbException) {
                sqlState = dbException.getSqlState();
            } else if (cursor instanceof SQLException sqlException) {
                sqlState = sqlException.getSQLState();
            }
            if (sqlState != null) {
                return sqlState.startsWith("23");
            }
            cursor = cursor.getCause();
        }
        return false;
    }
    
    public static DatabaseOperationException translate(String context, SQLException e) {
        String sqlState = e.getSQLState();
        return new DatabaseOperationException(
            context + ": " + e.getMessage() + (sqlState != null ? " [SQLState " + sqlState + "]" : ""),
            sqlState,
            isTransient(sqlState),
            e
        );
    }
}
