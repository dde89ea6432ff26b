package com.pgost.migration.progress;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Durable progress of one in-flight migration, stored next to the shadow table so a restarted
 * orchestrator can pick the run up where it stopped.
 */
@Value
@Builder(toBuilder = true)
public class MigrationProgress {
    String sourceTable;
    String shadowTable;
    String logTable;
    String ddlDigest;
    String runId;
    String phase;
    /** Highest source key when backfill started; rows above it arrive through replay. */
    Long snapshotMaxPk;
    /** Log position at snapshot time; backfill skips keys with newer changes. */
    Long snapshotSequence;
    /** Last key copied; null before the first chunk. */
    Long backfillCursor;
    boolean backfillComplete;
    long replayWatermark;
    OffsetDateTime startedAt;
    OffsetDateTime updatedAt;
    
    public boolean hasSnapshot() {
        return snapshotSequence != null;
    }
}
