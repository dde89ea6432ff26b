package com.pgost.migration.exception;

/**
 * Exception thrown inside a run when an abort was requested or the run cannot continue safely
 * and must be rolled back. The orchestrator answers it by tearing the migration down.
 */
public class MigrationAbortedException extends MigrationException {
    
    public MigrationAbortedException(String message) {
        super(message);
    }
    
    public MigrationAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
