package com.pgost.migration.orchestration.phases;

import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.DataMigrationException;
import com.pgost.migration.exception.MigrationAbortedException;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationPhase;
import com.pgost.migration.orchestration.MigrationTeardown;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Phase for waiting until replay has caught up and stays caught up, then stopping the replay loop.
 * Whatever is captured after this point is applied by the swap itself.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QuiescencePhase implements MigrationPhase {
    
    private final MigrationProperties properties;
    private final ChangeCaptureInstaller captureInstaller;
    private final MigrationTeardown teardown;
    private final Clock clock;
    
    @Override
    public void execute(MigrationContext context) throws Exception {
        MigrationProperties.QuiescenceConfig config = properties.getQuiescence();
        long start = clock.millis();
        long deadline = start + config.getTimeoutMs();
        Long stableSince = null;
        long lastReport = start;
        
        log.info("[Migration-{}] Waiting for backlog <= {} to hold for {}ms",
                context.getRunId(), config.getMaxBacklog(), config.getStableWindowMs());
        
        while (true) {
            if (context.isAbortRequested()) {
                throw new MigrationAbortedException("Abort requested while waiting for quiescence");
            }
            DataSyncPhase.checkReplayLoop(context);
            
            long backlog = captureInstaller.backlog(context.getControlSession(), context.getCaptureObjects());
            long now = clock.millis();
            
            if (backlog <= config.getMaxBacklog()) {
                if (stableSince == null) {
                    stableSince = now;
                }
                if (now - stableSince >= config.getStableWindowMs()) {
                    log.info("[Migration-{}] ✓ Quiescent: backlog {} for {}ms", context.getRunId(), backlog, now - stableSince);
                    break;
                }
            } else {
                stableSince = null;
            }
            
            if (now >= deadline) {
                throw new DataMigrationException("Replay did not reach quiescence within " + config.getTimeoutMs()
                    + "ms (backlog " + backlog + ")");
            }
            if (now - lastReport >= 10_000) {
                log.info("[Migration-{}] Backlog {} (watermark {})", context.getRunId(), backlog, context.getReplayWatermark());
                lastReport = now;
            }
            Thread.sleep(config.getCheckIntervalMs());
        }
        
        if (!teardown.stopReplayLoop(context)) {
            throw new DataMigrationException("Replay loop did not stop before cutover");
        }
        DataSyncPhase.checkReplayLoopFailure(context.getReplayLoop());
    }
    
    @Override
    public boolean shouldSkip(MigrationContext context) {
        return context.isReplayOnly();
    }
    
    @Override
    public String getPhaseName() {
        return "Quiescence Check";
    }
}
