package com.pgost.migration.orchestration.phases;

import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationPhase;
import com.pgost.migration.progress.MigrationProgressStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Phase for removing capture artifacts after a committed swap.
 * The new table is already live, so failures are logged for the operator and do not fail the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CleanupPhase implements MigrationPhase {
    
    private final ChangeCaptureInstaller captureInstaller;
    private final MigrationProgressStore progressStore;
    
    @Override
    public void execute(MigrationContext context) {
        try {
            // Triggers moved to the archived table with it; dropping the functions removes them there
            captureInstaller.uninstall(context.getControlSession(), context.getCaptureObjects());
        } catch (RuntimeException e) {
            log.warn("[Migration-{}] Could not remove change capture from {}: {}. Drop functions {} and {} and table {} manually.",
                    context.getRunId(), context.getArchivedTable(), e.getMessage(),
                    context.getCaptureObjects().getCaptureFunction(), context.getCaptureObjects().getTruncateGuardFunction(),
                    context.getCaptureObjects().getLogTable());
        }
        
        try {
            progressStore.delete(context.getControlSession(), context.getSourceTable());
        } catch (RuntimeException e) {
            log.warn("[Migration-{}] Could not delete the progress record for {}: {}",
                    context.getRunId(), context.getSourceTable(), e.getMessage());
        }
        
        log.info("[Migration-{}] Original table kept as {}", context.getRunId(), context.getArchivedTable());
    }
    
    @Override
    public boolean shouldSkip(MigrationContext context) {
        return context.isReplayOnly();
    }
    
    @Override
    public String getPhaseName() {
        return "Cleanup";
    }
}
