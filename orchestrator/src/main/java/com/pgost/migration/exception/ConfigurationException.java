package com.pgost.migration.exception;

/**
 * Exception thrown when the target database cannot host a migration (missing privileges, unsupported server).
 */
public class ConfigurationException extends MigrationException {
    
    public ConfigurationException(String message) {
        super(message);
    }
    
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
