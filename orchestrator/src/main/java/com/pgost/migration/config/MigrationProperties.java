package com.pgost.migration.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for migration operations.
 */
@Configuration
@ConfigurationProperties(prefix = "migration")
@Data
public class MigrationProperties {
    
    /**
     * Where shadow, log and archived tables live.
     */
    private SchemaConfig schema = new SchemaConfig();
    
    /**
     * Backfill chunking.
     */
    private BackfillConfig backfill = new BackfillConfig();
    
    /**
     * Replay batching and polling.
     */
    private ReplayConfig replay = new ReplayConfig();
    
    /**
     * Cutover eligibility.
     */
    private QuiescenceConfig quiescence = new QuiescenceConfig();
    
    /**
     * Swap transaction.
     */
    private CutoverConfig cutover = new CutoverConfig();
    
    /**
     * Retry configuration.
     */
    private RetryConfig retry = new RetryConfig();
    
    /**
     * Single run at startup, then exit.
     */
    private OneShotConfig oneShot = new OneShotConfig();
    
    /**
     * How long shutdown waits for aborting runs to clean up (milliseconds).
     */
    private long shutdownGraceMs = 30_000;
    
    @Data
    public static class SchemaConfig {
        /**
         * Schema holding shadow tables, change logs and the progress table.
         */
        private String shadowSchema = "post_migrations";
        
        /**
         * Schema original tables are moved into after a successful swap.
         */
        private String archiveSchema = "post_migrations_archive";
    }
    
    @Data
    public static class BackfillConfig {
        /**
         * Rows copied per transaction. Smaller chunks hold row locks for less time.
         */
        private int chunkSize = 1000;
    }
    
    @Data
    public static class ReplayConfig {
        /**
         * Change records applied per transaction.
         */
        private int batchSize = 500;
        
        /**
         * Sleep between drains when the log was empty (milliseconds).
         */
        private long pollIntervalMs = 200;
    }
    
    @Data
    public static class QuiescenceConfig {
        /**
         * How long the backlog must stay at or below maxBacklog before cutover (milliseconds).
         */
        private long stableWindowMs = 2000;
        
        /**
         * Largest backlog still counted as quiet.
         */
        private long maxBacklog = 0;
        
        /**
         * Interval between backlog measurements (milliseconds).
         */
        private long checkIntervalMs = 100;
        
        /**
         * Give up (and abort) when quiescence is not reached within this time (milliseconds).
         */
        private long timeoutMs = 600_000;
    }
    
    @Data
    public static class CutoverConfig {
        /**
         * lock_timeout for the exclusive lock taken by the swap (milliseconds).
         */
        private long lockTimeoutMs = 5000;
    }
    
    @Data
    public static class RetryConfig {
        /**
         * Maximum retry attempts for transient failures.
         */
        private int maxAttempts = 5;
        
        /**
         * Delay before the first retry (milliseconds).
         */
        private long delayMs = 200;
        
        /**
         * Backoff multiplier applied after each failed attempt.
         */
        private double multiplier = 2.0;
        
        /**
         * Upper bound for a single delay (milliseconds).
         */
        private long maxDelayMs = 5000;
    }
    
    @Data
    public static class OneShotConfig {
        /**
         * Run once at startup and exit with the outcome's exit code.
         */
        private boolean enabled = false;
        
        /**
         * "migrate" or "replay-only".
         */
        private String mode = "migrate";
        
        /**
         * Target DDL.
         */
        private String sql;
        
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String schema;
        private String user;
        private String password;
    }
}
