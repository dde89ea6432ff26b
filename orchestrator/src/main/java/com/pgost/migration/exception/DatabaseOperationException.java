package com.pgost.migration.exception;

import lombok.Getter;

/**
 * Exception thrown when a SQL statement fails.
 * Carries the SQLState and whether the failure is worth retrying.
 */
@Getter
public class DatabaseOperationException extends MigrationException {
    
    private final String sqlState;
    private final boolean transientFailure;
    
    public DatabaseOperationException(String message, String sqlState, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
        this.transientFailure = transientFailure;
    }
}
