package com.pgost.migration.runner;

import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.model.MigrationMode;
import com.pgost.migration.model.MigrationRequest;
import com.pgost.migration.model.MigrationStatus;
import com.pgost.migration.service.MigrationService;
import lombok.RequiredArgsConstructor;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs a single migration from configuration at startup.
 * The outcome's exit code (0 success, 2 bad input, 3 aborted or failed) is reported through
 * {@link ExitCodeGenerator}, so {@code SpringApplication.exit} hands it to the JVM.
 * <p>
 * When a signal stops the run instead, the JVM shutdown hook closes the context and the main thread never
 * reaches {@code System.exit}. A Spring shutdown handler then waits for the run's outcome and halts with its
 * exit code, so a replay-only run stopped by SIGTERM still exits 0.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "migration.one-shot", name = "enabled", havingValue = "true")
public class OneShotMigrationRunner implements ApplicationRunner, ExitCodeGenerator {
    
    private final MigrationProperties properties;
    private final MigrationService migrationService;
    
    private final CountDownLatch finished = new CountDownLatch(1);
    
    private volatile int exitCode = 0;
    private volatile boolean started;
    
    @PostConstruct
    void registerShutdownExit() {
        SpringApplication.getShutdownHandlers().add(this::exitWithOutcome);
    }
    
    @Override
    public void run(ApplicationArguments args) {
        started = true;
        try {
            runOnce();
        } finally {
            finished.countDown();
        }
    }
    
    private void runOnce() {
        MigrationProperties.OneShotConfig config = properties.getOneShot();
        
        MigrationMode mode;
        try {
            mode = parseMode(config.getMode());
        } catch (IllegalArgumentException e) {
            log.error("One-shot run not started: {}", e.getMessage());
            exitCode = MigrationStatus.REJECTED.getExitCode();
            return;
        }
        if (StringUtils.isBlank(config.getSql()) || StringUtils.isBlank(config.getDatabase()) || StringUtils.isBlank(config.getUser())) {
            log.error("One-shot run not started: migration.one-shot.sql, database and user are required");
            exitCode = MigrationStatus.REJECTED.getExitCode();
            return;
        }
        
        MigrationRequest request = MigrationRequest.builder()
            .connection(MigrationRequest.DbConfig.builder()
                .host(config.getHost())
                .port(config.getPort())
                .database(config.getDatabase())
                .schema(config.getSchema())
                .user(config.getUser())
                .password(config.getPassword())
                .build())
            .sql(config.getSql())
            .build();
        
        log.info("One-shot {} run against {}:{}/{}", mode, config.getHost(), config.getPort(), config.getDatabase());
        MigrationStatus outcome = migrationService.runMigration(request, mode);
        exitCode = outcome.getExitCode();
        log.info("One-shot run finished with status {} (exit code {})", outcome, exitCode);
    }
    
    @Override
    public int getExitCode() {
        return exitCode;
    }
    
    /**
     * Outcome exit code once the run has finished, or null if it never started or is still running after the timeout.
     */
    Integer exitCodeAfterShutdown(long timeoutMs) {
        if (!started) {
            return null;
        }
        try {
            if (!finished.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                return null;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
        return exitCode;
    }
    
    private void exitWithOutcome() {
        Integer code = exitCodeAfterShutdown(properties.getShutdownGraceMs());
        if (code == null) {
            log.warn("One-shot run had no outcome at shutdown, leaving the exit status to the JVM");
            return;
        }
        log.info("One-shot run stopped by shutdown, exiting with code {}", code);
        Runtime.getRuntime().halt(code);
    }
    
    static MigrationMode parseMode(String mode) {
        if (mode == null || mode.equalsIgnoreCase("migrate")) {
            return MigrationMode.MIGRATE;
        }
        if (mode.equalsIgnoreCase("replay-only") || mode.equalsIgnoreCase("replay_only")) {
            return MigrationMode.REPLAY_ONLY;
        }
        throw new IllegalArgumentException("Unknown one-shot mode: " + mode);
    }
}
