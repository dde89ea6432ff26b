package com.pgost.migration.orchestration.phases;

import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationPhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Phase for replay-only runs: keep capture and replay going until the operator stops the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReplayOnlyPhase implements MigrationPhase {
    
    private static final long REPORT_INTERVAL_MS = 30_000;
    
    private final MigrationProperties properties;
    
    @Override
    public void execute(MigrationContext context) throws Exception {
        log.info("[Migration-{}] Replay-only: capturing and replaying until stopped", context.getRunId());
        long lastReport = System.currentTimeMillis();
        
        while (!context.isAbortRequested()) {
            DataSyncPhase.checkReplayLoop(context);
            context.verifyTableLock();
            
            if (System.currentTimeMillis() - lastReport >= REPORT_INTERVAL_MS) {
                log.info("[Migration-{}] Replayed {} change(s), watermark {}",
                        context.getRunId(), context.getChangesApplied(), context.getReplayWatermark());
                lastReport = System.currentTimeMillis();
            }
            Thread.sleep(properties.getReplay().getPollIntervalMs());
        }
        log.info("[Migration-{}] Replay-only run stopped by operator", context.getRunId());
    }
    
    @Override
    public boolean shouldSkip(MigrationContext context) {
        return !context.isReplayOnly();
    }
    
    @Override
    public String getPhaseName() {
        return "Replay Only";
    }
}
