package com.pgost.migration.orchestration;

import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.exception.MigrationException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.progress.MigrationProgressStore;
import com.pgost.migration.replay.ReplayLoop;
import com.pgost.migration.shadow.ShadowTableManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes everything a migration created before cutover: triggers, log table, shadow table and
 * progress row. Every step is idempotent, so it also clears the leftovers of a crashed run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MigrationTeardown {
    
    private static final long REPLAY_STOP_TIMEOUT_MS = 30_000;
    
    private final ChangeCaptureInstaller captureInstaller;
    private final ShadowTableManager shadowManager;
    private final MigrationProgressStore progressStore;
    
    /**
     * Stop the background replay loop and wait for its batch in flight.
     *
     * @return false when the loop did not stop in time
     */
    public boolean stopReplayLoop(MigrationContext context) {
        ReplayLoop loop = context.getReplayLoop();
        if (loop == null || loop.isFinished()) {
            return true;
        }
        try {
            boolean stopped = loop.stopAndAwait(REPLAY_STOP_TIMEOUT_MS);
            if (!stopped) {
                log.warn("[Migration-{}] Replay loop did not stop within {}ms", context.getRunId(), REPLAY_STOP_TIMEOUT_MS);
            }
            return stopped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
    
    /**
     * Drop all migration artifacts, leaving the source table as it was before the run.
     * Triggers go first so the source stops writing to the log before the log is dropped.
     *
     * @throws MigrationException listing the steps that failed; the remaining steps still run
     */
    public void removeArtifacts(MigrationContext context) {
        DatabaseSession session = context.getControlSession();
        List<String> failures = new ArrayList<>();
        
        try {
            captureInstaller.uninstall(session, context.getCaptureObjects());
        } catch (RuntimeException e) {
            log.error("[Migration-{}] Failed to remove change capture: {}", context.getRunId(), e.getMessage());
            failures.add("change capture: " + e.getMessage());
        }
        
        try {
            shadowManager.drop(session, context.getShadowTable());
        } catch (RuntimeException e) {
            log.error("[Migration-{}] Failed to drop shadow table: {}", context.getRunId(), e.getMessage());
            failures.add("shadow table: " + e.getMessage());
        }
        
        // Last, so an interrupted teardown is still recognised on the next submission
        try {
            progressStore.delete(session, context.getSourceTable());
        } catch (RuntimeException e) {
            log.error("[Migration-{}] Failed to delete progress record: {}", context.getRunId(), e.getMessage());
            failures.add("progress record: " + e.getMessage());
        }
        
        if (!failures.isEmpty()) {
            throw new MigrationException("Teardown of " + context.getSourceTable() + " incomplete: " + failures);
        }
        log.info("[Migration-{}] ✓ Migration artifacts removed, {} untouched", context.getRunId(), context.getSourceTable());
    }
}
