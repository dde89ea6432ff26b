package com.pgost.migration.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for migration runs and for the backfill/replay workers inside a run.
 */
@Configuration
public class AsyncConfiguration {
    
    /**
     * Runs whole migrations (one thread per active migration).
     */
    @Bean(name = "migrationExecutor")
    public ThreadPoolTaskExecutor migrationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("migration-");
        executor.initialize();
        return executor;
    }
    
    /**
     * Replay loops, one per active migration.
     */
    @Bean(name = "migrationWorkerExecutor")
    public ThreadPoolTaskExecutor migrationWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("migration-worker-");
        executor.initialize();
        return executor;
    }
}
