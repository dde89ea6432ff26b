package com.pgost.migration.exception;

/**
 * Exception thrown when a session's connection was replaced and an advisory lock it held could not be
 * taken again because another session got it first. The run no longer owns its table.
 */
public class AdvisoryLockLostException extends MigrationException {
    
    public AdvisoryLockLostException(String message) {
        super(message);
    }
}
