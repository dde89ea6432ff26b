package com.pgost.migration.service;

import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.MigrationException;
import com.pgost.migration.model.MigrationMode;
import com.pgost.migration.model.MigrationRequest;
import com.pgost.migration.model.MigrationRun;
import com.pgost.migration.model.MigrationRunRepository;
import com.pgost.migration.model.MigrationStatus;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationOrchestrator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for starting, tracking and aborting migration runs.
 */
@Service
@Slf4j
public class MigrationService {
    
    private final MigrationRunRepository runRepository;
    private final MigrationOrchestrator migrationOrchestrator;
    private final MigrationProperties properties;
    private final TaskExecutor migrationExecutor;
    
    /**
     * Runs still executing in this process, by run id.
     */
    private final Map<Long, MigrationContext> activeRuns = new ConcurrentHashMap<>();
    
    public MigrationService(
            MigrationRunRepository runRepository,
            MigrationOrchestrator migrationOrchestrator,
            MigrationProperties properties,
            @Qualifier("migrationExecutor") TaskExecutor migrationExecutor) {
        this.runRepository = runRepository;
        this.migrationOrchestrator = migrationOrchestrator;
        this.properties = properties;
        this.migrationExecutor = migrationExecutor;
    }
    
    public Optional<MigrationRun> getRun(Long id) {
        return runRepository.findById(id);
    }
    
    /**
     * Record a new run and start it in the background.
     */
    public MigrationRun startMigration(MigrationRequest request, MigrationMode mode) {
        MigrationRun run = createRun(request, mode);
        MigrationContext context = new MigrationContext(String.valueOf(run.getId()), request, mode);
        activeRuns.put(run.getId(), context);
        
        try {
            migrationExecutor.execute(() -> runMigrationLifecycle(run.getId(), context));
        } catch (TaskRejectedException e) {
            activeRuns.remove(run.getId());
            updateStatus(run.getId(), context, MigrationStatus.REJECTED, "Too many migrations running");
            throw new MigrationException("Too many migrations running, try again later", e);
        }
        return run;
    }
    
    /**
     * Record a new run and execute it on the calling thread.
     *
     * @return the final status
     */
    public MigrationStatus runMigration(MigrationRequest request, MigrationMode mode) {
        MigrationRun run = createRun(request, mode);
        MigrationContext context = new MigrationContext(String.valueOf(run.getId()), request, mode);
        activeRuns.put(run.getId(), context);
        return runMigrationLifecycle(run.getId(), context);
    }
    
    /**
     * Ask a running migration to abort (or a replay-only run to stop).
     */
    public AbortResult requestAbort(Long id) {
        MigrationContext context = activeRuns.get(id);
        if (context == null) {
            return runRepository.existsById(id) ? AbortResult.NOT_ABORTABLE : AbortResult.NOT_FOUND;
        }
        if (!context.requestAbort()) {
            log.warn("[Migration-{}] Abort refused: cutover has begun", id);
            return AbortResult.NOT_ABORTABLE;
        }
        log.info("[Migration-{}] Abort requested", id);
        return AbortResult.ACCEPTED;
    }
    
    /**
     * Run the migration lifecycle.
     * Uses MigrationOrchestrator to execute phases in sequence.
     */
    private MigrationStatus runMigrationLifecycle(Long runId, MigrationContext context) {
        log.info("[Migration-{}] Migration lifecycle started", runId);
        
        try {
            return migrationOrchestrator.executeMigrationLifecycle(
                context,
                (status, error) -> updateStatus(runId, context, status, error)
            );
            
        } catch (Exception e) {
            log.error("[Migration-{}] Unexpected error in lifecycle execution: {}", runId, e.getMessage(), e);
            updateStatus(runId, context, MigrationStatus.FAILED, e.getMessage());
            return MigrationStatus.FAILED;
        } finally {
            activeRuns.remove(runId);
        }
    }
    
    private MigrationRun createRun(MigrationRequest request, MigrationMode mode) {
        MigrationRequest.DbConfig connection = request.getConnection();
        MigrationRun run = MigrationRun.builder()
            .mode(mode)
            .target(connection.getHost() + ":" + connection.toConnectionConfig().getPortOrDefault() + "/" + connection.getDatabase())
            .status(MigrationStatus.PENDING)
            .ddl(request.getSql())
            .build();
        MigrationRun saved = runRepository.save(run);
        log.info("[Migration-{}] Created {} run against {}", saved.getId(), mode, saved.getTarget());
        return saved;
    }
    
    /**
     * Helper to update run status transactionally, together with the progress the context holds.
     * A failing audit write is logged and never stops the migration.
     */
    @Transactional
    public void updateStatus(Long runId, MigrationContext context, MigrationStatus status, String error) {
        try {
            MigrationRun run = runRepository.findById(runId)
                    .orElseThrow(() -> new MigrationException("Run not found: " + runId));
            run.setStatus(status);
            if (error != null) {
                run.setLastError(error);
            }
            if (context.getSourceTable() != null) {
                run.setSourceTable(context.getSourceTable().toString());
            }
            run.setBackfillCursor(context.getBackfillCursor());
            run.setReplayWatermark(context.getReplayWatermark());
            if (context.getArchivedTable() != null) {
                run.setArchivedTable(context.getArchivedTable().toString());
            }
            runRepository.save(run);
            log.info("[Migration-{}] Status updated to: {}", runId, status);
        } catch (RuntimeException e) {
            log.error("[Migration-{}] Could not record status {}: {}", runId, status, e.getMessage());
        }
    }
    
    /**
     * Runs left non-terminal by a previous process can no longer be driven from here.
     * Their database-side state is resumed by re-submitting the same DDL.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void markInterruptedRuns() {
        List<MigrationRun> interrupted = runRepository.findRunningRuns();
        for (MigrationRun run : interrupted) {
            if (activeRuns.containsKey(run.getId())) {
                continue;
            }
            log.warn("[Migration-{}] Run was interrupted in status {}", run.getId(), run.getStatus());
            run.setLastError("Interrupted in status " + run.getStatus() + " by a restart; re-submit the same DDL to resume or abort it");
            run.setStatus(MigrationStatus.FAILED);
            runRepository.save(run);
        }
    }
    
    /**
     * Abort every active run on shutdown and give them a bounded time to clean up.
     */
    @PreDestroy
    public void abortActiveRuns() {
        if (activeRuns.isEmpty()) {
            return;
        }
        log.warn("Shutdown: requesting abort of {} active migration(s)", activeRuns.size());
        activeRuns.forEach((id, context) -> {
            if (!context.requestAbort()) {
                log.warn("[Migration-{}] In cutover, letting it finish", id);
            }
        });
        
        long deadline = System.currentTimeMillis() + properties.getShutdownGraceMs();
        while (!activeRuns.isEmpty() && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (!activeRuns.isEmpty()) {
            log.error("Shutdown grace period elapsed with {} migration(s) still running: {}", activeRuns.size(), activeRuns.keySet());
        }
    }
    
    public enum AbortResult {
        ACCEPTED,
        NOT_FOUND,
        NOT_ABORTABLE
    }
}
