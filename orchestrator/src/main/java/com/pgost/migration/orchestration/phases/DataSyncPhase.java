package com.pgost.migration.orchestration.phases;

import com.pgost.migration.backfill.BackfillEngine;
import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.exception.DataMigrationException;
import com.pgost.migration.exception.MigrationAbortedException;
import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.infrastructure.database.DatabaseConnectionFactory;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationPhase;
import com.pgost.migration.progress.MigrationProgressStore;
import com.pgost.migration.replay.ReplayLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Phase for backfilling the shadow table while the replay loop keeps applying captured changes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DataSyncPhase implements MigrationPhase {
    
    private final DatabaseConnectionFactory connectionFactory;
    private final ChangeCaptureInstaller captureInstaller;
    private final MigrationProgressStore progressStore;
    private final BackfillEngine backfillEngine;
    
    @Override
    public void execute(MigrationContext context) throws Exception {
        if (!context.isSnapshotTaken()) {
            takeSnapshot(context);
        }
        
        boolean finished;
        try (DatabaseSession session = connectionFactory.openSession(context.getConnectionConfig(), "backfill-" + context.getRunId())) {
            finished = backfillEngine.run(session, context);
        }
        if (!finished) {
            throw new MigrationAbortedException("Abort requested during backfill");
        }
        
        checkReplayLoop(context);
    }
    
    /**
     * Fix the key range backfill covers. Keys above the snapshot are inserted after capture started,
     * so replay delivers them.
     */
    private void takeSnapshot(MigrationContext context) {
        DatabaseSession control = context.getControlSession();
        Long maxPk = control.queryForLong("SELECT max(" + context.getPrimaryKey().quotedName() + ") FROM "
            + context.getSourceTable().qualified());
        long sequence = Math.max(captureInstaller.lastSequence(control, context.getCaptureObjects()), context.getReplayWatermark());
        
        progressStore.recordSnapshot(control, context.getSourceTable(), maxPk, sequence);
        context.setSnapshotMaxPk(maxPk);
        context.setSnapshotSequence(sequence);
        context.setSnapshotTaken(true);
        if (maxPk == null) {
            context.setBackfillComplete(true);
        }
        log.info("[Migration-{}] Snapshot taken: max key {}, log sequence {}", context.getRunId(), maxPk, sequence);
    }
    
    /**
     * Fail when the replay loop has died; it must run for as long as capture does.
     */
    static void checkReplayLoop(MigrationContext context) {
        ReplayLoop loop = context.getReplayLoop();
        checkReplayLoopFailure(loop);
        if (loop != null && loop.isFinished() && !context.isAbortRequested()) {
            throw new DataMigrationException("Replay loop stopped unexpectedly");
        }
    }
    
    /**
     * Rethrow the replay loop's failure. A change the new definition cannot hold stays a validation error.
     */
    static void checkReplayLoopFailure(ReplayLoop loop) {
        if (loop == null || loop.getFailure() == null) {
            return;
        }
        RuntimeException failure = loop.getFailure();
        if (failure instanceof ValidationException) {
            throw new ValidationException("Replay failed: " + failure.getMessage(), failure);
        }
        throw new DataMigrationException("Replay failed: " + failure.getMessage(), failure);
    }
    
    @Override
    public boolean shouldSkip(MigrationContext context) {
        return context.isReplayOnly();
    }
    
    @Override
    public String getPhaseName() {
        return "Backfill";
    }
}
