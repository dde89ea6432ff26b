package com.pgost.migration.exception;

/**
 * Exception thrown when the submitted migration is invalid: bad DDL, missing table or unusable primary key.
 * Raised before any database object is created.
 */
public class ValidationException extends MigrationException {
    
    public ValidationException(String message) {
        super(message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
