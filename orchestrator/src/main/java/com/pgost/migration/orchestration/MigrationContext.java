package com.pgost.migration.orchestration;

import com.pgost.migration.capture.CaptureObjects;
import com.pgost.migration.ddl.ShadowDefinition;
import com.pgost.migration.infrastructure.database.DatabaseConnectionConfig;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.ColumnMap;
import com.pgost.migration.model.MigrationMode;
import com.pgost.migration.model.MigrationRequest;
import com.pgost.migration.model.MigrationStatus;
import com.pgost.migration.model.PrimaryKeyColumn;
import com.pgost.migration.model.TableName;
import com.pgost.migration.replay.ReplayLoop;
import lombok.Data;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Context object that carries state through the migration lifecycle.
 * Shared across all phases and with the replay loop, so the fields the loop touches are volatile.
 */
@Data
public class MigrationContext {
    
    private final String runId;
    private final MigrationRequest request;
    private final MigrationMode mode;
    private final DatabaseConnectionConfig connectionConfig;
    
    // Filled in by INIT
    private ShadowDefinition shadowDefinition;
    private TableName sourceTable;
    private TableName shadowTable;
    private CaptureObjects captureObjects;
    private PrimaryKeyColumn primaryKey;
    private String ddlDigest;
    private boolean resumed;
    /** Shadow, log or progress row from an earlier run that cannot be resumed and must be cleared first. */
    private boolean leftoversFound;
    
    /**
     * Holds the advisory lock for the whole run; runs DDL and the swap.
     */
    private DatabaseSession controlSession;
    private String advisoryLockKey;
    private boolean lockHeld;
    
    // Filled in by capture installation
    private ColumnMap columnMap;
    
    // Backfill snapshot and progress
    private boolean snapshotTaken;
    private Long snapshotMaxPk;
    private long snapshotSequence;
    private volatile Long backfillCursor;
    private volatile boolean backfillComplete;
    private volatile long rowsCopied;
    
    // Replay progress, written by the replay loop
    private volatile long replayWatermark;
    private volatile long changesApplied;
    private ReplayLoop replayLoop;
    
    private volatile MigrationStatus status = MigrationStatus.PENDING;
    private TableName archivedTable;
    
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);
    private final AtomicBoolean cutoverStarted = new AtomicBoolean(false);
    
    public MigrationContext(String runId, MigrationRequest request, MigrationMode mode) {
        this.runId = runId;
        this.request = request;
        this.mode = mode;
        this.connectionConfig = request.getConnection().toConnectionConfig();
    }
    
    /**
     * Ask the run to stop. Refused once cutover has begun.
     *
     * @return true when the request was accepted
     */
    public synchronized boolean requestAbort() {
        if (cutoverStarted.get()) {
            return false;
        }
        abortRequested.set(true);
        return true;
    }
    
    public boolean isAbortRequested() {
        return abortRequested.get();
    }
    
    /**
     * Commit to cutover. Fails when an abort got in first.
     */
    public synchronized boolean beginCutover() {
        if (abortRequested.get()) {
            return false;
        }
        cutoverStarted.set(true);
        return true;
    }
    
    public boolean isCutoverStarted() {
        return cutoverStarted.get();
    }
    
    public boolean isReplayOnly() {
        return mode == MigrationMode.REPLAY_ONLY;
    }
    
    /**
     * Check that the control session still holds the table lock. Only call from the orchestrating thread.
     */
    public void verifyTableLock() {
        if (controlSession != null && lockHeld) {
            controlSession.verifyAdvisoryLocks();
        }
    }
}
