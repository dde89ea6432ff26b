package com.pgost.migration.util;

import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.MigrationAbortedException;
import com.pgost.migration.exception.MigrationException;
import com.pgost.migration.infrastructure.database.SqlErrorClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Utility class for retry logic with exponential backoff.
 * Only failures classified as transient are retried; anything else is rethrown at once.
 */
@Slf4j
public class RetryUtil {
    
    private RetryUtil() {
        // Utility class - prevent instantiation
    }
    
    /**
     * Execute operation with retry logic.
     * 
     * @param operation The operation to execute
     * @param retry Attempts and backoff settings
     * @param operationName Name of the operation for logging
     * @return Result of the operation
     * @throws RuntimeException the last failure, once it is permanent or attempts are exhausted
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            MigrationProperties.RetryConfig retry,
            String operationName) {
        return executeWithRetry(operation, retry, operationName, () -> false);
    }
    
    /**
     * Execute operation with retry logic, giving up between attempts once {@code cancelled} reports true.
     *
     * @throws MigrationAbortedException when cancelled after a transient failure, with that failure as cause
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            MigrationProperties.RetryConfig retry,
            String operationName,
            BooleanSupplier cancelled) {
        
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        long currentDelay = retry.getDelayMs();
        
        for (int attempt = 1; ; attempt++) {
            try {
                log.debug("Attempting {}: attempt {}/{}", operationName, attempt, maxAttempts);
                return operation.get();
                
            } catch (RuntimeException e) {
                if (!SqlErrorClassifier.isTransient(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("All {} attempts failed for {}", maxAttempts, operationName);
                    throw e;
                }
                
                if (cancelled.getAsBoolean()) {
                    log.info("Not retrying {} after attempt {}: cancelled", operationName, attempt);
                    throw new MigrationAbortedException("Abort requested while retrying " + operationName, e);
                }
                
                log.warn("Attempt {}/{} failed for {}: {}. Retrying in {}ms...",
                        attempt, maxAttempts, operationName, e.getMessage(), currentDelay);
                sleep(currentDelay, operationName);
                currentDelay = Math.min(retry.getMaxDelayMs(), (long) (currentDelay * retry.getMultiplier()));
            }
        }
    }
    
    /**
     * Execute operation with retry logic (void return).
     */
    public static void executeWithRetryVoid(
            Runnable operation,
            MigrationProperties.RetryConfig retry,
            String operationName) {
        
        executeWithRetry(() -> {
            operation.run();
            return null;
        }, retry, operationName);
    }
    
    private static void sleep(long delayMs, String operationName) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new MigrationException("Retry of " + operationName + " interrupted", ie);
        }
    }
}
