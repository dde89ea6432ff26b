package com.pgost.migration.orchestration;

import com.pgost.migration.capture.CaptureObjects;
import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.exception.AdvisoryLockLostException;
import com.pgost.migration.exception.CutoverException;
import com.pgost.migration.exception.MigrationAbortedException;
import com.pgost.migration.exception.MigrationException;
import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.MigrationStatus;
import com.pgost.migration.orchestration.phases.*;
import com.pgost.migration.progress.MigrationProgressStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrator for the migration lifecycle.
 * Drives a run through INIT, CAPTURE_INSTALLED, BACKFILLING, REPLAYING, QUIESCENCE_CHECK, CUTOVER and
 * CLEANUP. A failure or abort before cutover tears the migration down (ABORTING, ABORTED); a failure
 * once cutover has begun ends in FAILED and is left for the operator.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MigrationOrchestrator {
    
    // Phase implementations
    private final InitPhase initPhase;
    private final CaptureInstallationPhase captureInstallationPhase;
    private final DataSyncPhase dataSyncPhase;
    private final ReplayOnlyPhase replayOnlyPhase;
    private final QuiescencePhase quiescencePhase;
    private final CutoverPhase cutoverPhase;
    private final CleanupPhase cleanupPhase;
    
    // For abort
    private final MigrationTeardown teardown;
    private final MigrationProgressStore progressStore;
    
    /**
     * Execute the complete migration lifecycle.
     * 
     * @param context The migration context, shared with whoever may request an abort
     * @param statusCallback Callback to update run status
     * @return The final run status
     */
    public MigrationStatus executeMigrationLifecycle(MigrationContext context, StatusUpdateCallback statusCallback) {
        String runId = context.getRunId();
        log.info("[Migration-{}] ========== MIGRATION LIFECYCLE STARTED ({}) ==========", runId, context.getMode());
        
        try {
            try {
                executePhaseIfNeeded(initPhase, context, MigrationStatus.INIT, statusCallback);
            } catch (MigrationException e) {
                log.error("[Migration-{}] ========== MIGRATION REJECTED ==========", runId);
                log.error("[Migration-{}] Error: {}", runId, e.getMessage());
                return finish(context, MigrationStatus.REJECTED, e.getMessage(), statusCallback);
            }
            
            try {
                executePhaseIfNeeded(captureInstallationPhase, context, MigrationStatus.CAPTURE_INSTALLED, statusCallback);
                executePhaseIfNeeded(replayOnlyPhase, context, MigrationStatus.REPLAYING, statusCallback);
                executePhaseIfNeeded(dataSyncPhase, context, MigrationStatus.BACKFILLING, statusCallback);
                
                if (context.isReplayOnly()) {
                    return finishReplayOnly(context, statusCallback);
                }
                
                transition(context, MigrationStatus.REPLAYING, statusCallback);
                executePhaseIfNeeded(quiescencePhase, context, MigrationStatus.QUIESCENCE_CHECK, statusCallback);
                
                if (!context.beginCutover()) {
                    throw new MigrationAbortedException("Abort requested before cutover");
                }
                executePhaseIfNeeded(cutoverPhase, context, MigrationStatus.CUTOVER, statusCallback);
                executePhaseIfNeeded(cleanupPhase, context, MigrationStatus.CLEANUP, statusCallback);
                
                log.info("[Migration-{}] ========== MIGRATION LIFECYCLE COMPLETE ==========", runId);
                log.info("[Migration-{}] {} swapped in, original archived as {}", runId,
                        context.getSourceTable(), context.getArchivedTable());
                return finish(context, MigrationStatus.DONE, null, statusCallback);
                
            } catch (MigrationException e) {
                if (context.isCutoverStarted()) {
                    return fail(context, e, statusCallback);
                }
                return abort(context, e, statusCallback);
            }
            
        } finally {
            teardown.stopReplayLoop(context);
            releaseControlSession(context);
        }
    }
    
    /**
     * Execute a phase if it shouldn't be skipped.
     */
    private void executePhaseIfNeeded(
            MigrationPhase phase,
            MigrationContext context,
            MigrationStatus status,
            StatusUpdateCallback statusCallback) {
        
        if (phase.shouldSkip(context)) {
            log.debug("[Migration-{}] Skipping phase: {}", context.getRunId(), phase.getPhaseName());
            return;
        }
        
        log.info("[Migration-{}] Starting phase: {}", context.getRunId(), phase.getPhaseName());
        transition(context, status, statusCallback);
        
        try {
            phase.execute(context);
            log.info("[Migration-{}] Completed phase: {}", context.getRunId(), phase.getPhaseName());
            
        } catch (MigrationException e) {
            log.error("[Migration-{}] Failed phase: {}", context.getRunId(), phase.getPhaseName());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationAbortedException("Interrupted during phase '" + phase.getPhaseName() + "'", e);
        } catch (Exception e) {
            log.error("[Migration-{}] Failed phase: {}", context.getRunId(), phase.getPhaseName());
            throw new MigrationException(
                "Phase '" + phase.getPhaseName() + "' failed: " + e.getMessage(), 
                e
            );
        }
    }
    
    private void transition(MigrationContext context, MigrationStatus status, StatusUpdateCallback statusCallback) {
        context.setStatus(status);
        statusCallback.updateStatus(status, null);
        
        // The progress row exists from capture installation until cleanup
        if (status != MigrationStatus.INIT && status != MigrationStatus.CLEANUP && status != MigrationStatus.ABORTING) {
            try {
                progressStore.updatePhase(context.getControlSession(), context.getSourceTable(), context.getRunId(), status.name());
            } catch (AdvisoryLockLostException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Migration-{}] Could not record phase {}: {}", context.getRunId(), status, e.getMessage());
            }
        }
    }
    
    private MigrationStatus finishReplayOnly(MigrationContext context, StatusUpdateCallback statusCallback) {
        transition(context, MigrationStatus.CLEANUP, statusCallback);
        teardown.stopReplayLoop(context);
        try {
            teardown.removeArtifacts(context);
        } catch (MigrationException e) {
            return fail(context, e, statusCallback);
        }
        log.info("[Migration-{}] ========== REPLAY-ONLY RUN COMPLETE ({} change(s) replayed) ==========",
                context.getRunId(), context.getChangesApplied());
        return finish(context, MigrationStatus.DONE, null, statusCallback);
    }
    
    /**
     * Tear down a migration that has not reached cutover. A DDL the server rejected while building the
     * shadow still counts as bad input.
     */
    private MigrationStatus abort(MigrationContext context, MigrationException cause, StatusUpdateCallback statusCallback) {
        String runId = context.getRunId();
        if (cause instanceof AdvisoryLockLostException) {
            return abandon(context, cause, statusCallback);
        }
        boolean requested = cause instanceof MigrationAbortedException;
        if (requested) {
            log.warn("[Migration-{}] ========== MIGRATION ABORTING ==========", runId);
            log.warn("[Migration-{}] Reason: {}", runId, cause.getMessage());
        } else {
            log.error("[Migration-{}] ========== MIGRATION LIFECYCLE FAILED, ABORTING ==========", runId);
            log.error("[Migration-{}] Error in phase {} (cursor={}, watermark={}): {}", runId, context.getStatus(),
                    context.getBackfillCursor(), context.getReplayWatermark(), cause.getMessage(), cause);
        }
        
        context.setStatus(MigrationStatus.ABORTING);
        statusCallback.updateStatus(MigrationStatus.ABORTING, cause.getMessage());
        teardown.stopReplayLoop(context);
        
        try {
            teardown.removeArtifacts(context);
        } catch (MigrationException teardownError) {
            log.error("[Migration-{}] Abort could not remove every artifact: {}", runId, teardownError.getMessage());
            return finish(context, MigrationStatus.FAILED,
                cause.getMessage() + "; " + teardownError.getMessage(), statusCallback);
        }
        
        MigrationStatus outcome = cause instanceof ValidationException ? MigrationStatus.REJECTED : MigrationStatus.ABORTED;
        log.warn("[Migration-{}] ========== MIGRATION {} ==========", runId, outcome);
        return finish(context, outcome, cause.getMessage(), statusCallback);
    }
    
    /**
     * Stop a run that lost its table lock. Another run may own the shadow and log now, so nothing is dropped.
     */
    private MigrationStatus abandon(MigrationContext context, MigrationException cause, StatusUpdateCallback statusCallback) {
        String runId = context.getRunId();
        log.error("[Migration-{}] ========== MIGRATION ABANDONED ==========", runId);
        log.error("[Migration-{}] {} (phase {}, cursor={}, watermark={})", runId, cause.getMessage(), context.getStatus(),
                context.getBackfillCursor(), context.getReplayWatermark());
        teardown.stopReplayLoop(context);
        context.setLockHeld(false);
        return finish(context, MigrationStatus.FAILED, cause.getMessage()
            + ". Artifacts were left in place; if no other migration of " + context.getSourceTable()
            + " is running, re-submit the same DDL to resume it or abort it", statusCallback);
    }
    
    private MigrationStatus fail(MigrationContext context, MigrationException cause, StatusUpdateCallback statusCallback) {
        String runId = context.getRunId();
        log.error("[Migration-{}] ========== MIGRATION FAILED ==========", runId);
        String message = cause.getMessage();
        if (cause instanceof CutoverException cutoverError) {
            message = cutoverError.getRemediation();
        }
        message = message + " " + captureRemovalHint(context.getCaptureObjects());
        log.error("[Migration-{}] {}", runId, message, cause);
        return finish(context, MigrationStatus.FAILED, message, statusCallback);
    }
    
    /**
     * Capture stays installed after a failed swap and its log grows with every write until it is removed.
     */
    static String captureRemovalHint(CaptureObjects objects) {
        if (objects == null) {
            return "";
        }
        return "Change capture on " + objects.getSourceTable() + " is still installed and " + objects.getLogTable()
            + " grows with every write until it is removed with: "
            + String.join("; ", ChangeCaptureInstaller.uninstallStatements(objects)) + ";";
    }
    
    private MigrationStatus finish(MigrationContext context, MigrationStatus status, String error, StatusUpdateCallback statusCallback) {
        context.setStatus(status);
        statusCallback.updateStatus(status, error);
        return status;
    }
    
    private void releaseControlSession(MigrationContext context) {
        DatabaseSession control = context.getControlSession();
        if (control == null) {
            return;
        }
        if (context.isLockHeld()) {
            try {
                control.releaseAdvisoryLock(context.getAdvisoryLockKey());
            } catch (RuntimeException e) {
                log.warn("[Migration-{}] Could not release advisory lock: {}", context.getRunId(), e.getMessage());
            }
            context.setLockHeld(false);
        }
        control.close();
    }
    
    /**
     * Callback interface for status updates.
     */
    @FunctionalInterface
    public interface StatusUpdateCallback {
        void updateStatus(MigrationStatus status, String error);
    }
}
