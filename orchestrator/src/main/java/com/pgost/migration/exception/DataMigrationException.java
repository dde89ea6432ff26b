package com.pgost.migration.exception;

/**
 * Exception thrown when backfill, replay or quiescence fails before cutover.
 * The migration can still be aborted safely.
 */
public class DataMigrationException extends MigrationException {
    
    public DataMigrationException(String message) {
        super(message);
    }
    
    public DataMigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
