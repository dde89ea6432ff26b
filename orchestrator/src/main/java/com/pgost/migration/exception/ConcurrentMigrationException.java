package com.pgost.migration.exception;

/**
 * Exception thrown when another migration already holds the source table.
 */
public class ConcurrentMigrationException extends ValidationException {
    
    public ConcurrentMigrationException(String message) {
        super(message);
    }
    
    public ConcurrentMigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
