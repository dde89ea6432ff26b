package com.pgost.migration.backfill;

import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.DatabaseOperationException;
import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.infrastructure.database.SqlErrorClassifier;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.progress.MigrationProgressStore;
import com.pgost.migration.util.RetryUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies existing source rows into the shadow table in primary-key order, one chunk per transaction.
 * <p>
 * Each chunk locks its source rows FOR SHARE, so a concurrent delete or update of a row waits until the
 * copy has committed and is then captured after it. Rows whose key has a change newer than the snapshot
 * are left to replay, and a row replay already wrote is never overwritten. Only a primary-key
 * collision is skipped: existing rows that break any other constraint of the new definition reject
 * the migration. The cursor commits with the chunk, so a restart continues after the last copied key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackfillEngine {
    
    private final MigrationProperties properties;
    private final MigrationProgressStore progressStore;
    
    /**
     * Copy chunks until the snapshot's highest key is reached or an abort is requested.
     *
     * @return true when backfill finished, false when it stopped early because of an abort
     */
    public boolean run(DatabaseSession session, MigrationContext context) {
        if (context.isBackfillComplete() || context.getSnapshotMaxPk() == null) {
            log.info("[Migration-{}] Nothing to backfill", context.getRunId());
            context.setBackfillComplete(true);
            return true;
        }
        
        int chunkSize = properties.getBackfill().getChunkSize();
        long upperBound = context.getSnapshotMaxPk();
        log.info("[Migration-{}] Backfill {} -> {} up to key {} in chunks of {} (starting after {})",
                context.getRunId(), context.getSourceTable(), context.getShadowTable(), upperBound, chunkSize,
                context.getBackfillCursor() == null ? "the beginning" : context.getBackfillCursor());
        
        long chunks = 0;
        while (!context.isBackfillComplete()) {
            if (context.isAbortRequested()) {
                log.info("[Migration-{}] Backfill stopped at key {} on abort", context.getRunId(), context.getBackfillCursor());
                return false;
            }
            context.verifyTableLock();
            
            ChunkResult chunk;
            try {
                chunk = RetryUtil.executeWithRetry(
                    () -> copyChunk(session, context, chunkSize, upperBound),
                    properties.getRetry(),
                    "backfill chunk after " + context.getBackfillCursor(),
                    context::isAbortRequested);
            } catch (DatabaseOperationException e) {
                if (SqlErrorClassifier.isConstraintViolation(e)) {
                    throw new ValidationException("Existing rows of " + context.getSourceTable()
                        + " violate a constraint of the new table definition: " + e.getMessage(), e);
                }
                throw e;
            }
            
            context.setRowsCopied(context.getRowsCopied() + chunk.rowsCopied);
            if (chunk.lastKey != null) {
                context.setBackfillCursor(chunk.lastKey);
            }
            context.setBackfillComplete(chunk.complete);
            
            if (++chunks % 100 == 0) {
                log.info("[Migration-{}] Backfill progress: cursor={}, rows copied={}",
                        context.getRunId(), context.getBackfillCursor(), context.getRowsCopied());
            }
        }
        
        log.info("[Migration-{}] ✓ Backfill complete: {} rows copied in {} chunks",
                context.getRunId(), context.getRowsCopied(), chunks);
        return true;
    }
    
    private ChunkResult copyChunk(DatabaseSession session, MigrationContext context, int chunkSize, long upperBound) {
        Long cursor = context.getBackfillCursor();
        
        return session.inTransaction(conn -> {
            List<Long> keys = new ArrayList<>(chunkSize);
            try (PreparedStatement stmt = conn.prepareStatement(selectKeysSql(context, cursor != null))) {
                int index = 1;
                if (cursor != null) {
                    stmt.setLong(index++, cursor);
                }
                stmt.setLong(index++, upperBound);
                stmt.setInt(index, chunkSize);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        keys.add(rs.getLong(1));
                    }
                }
            }
            
            if (keys.isEmpty()) {
                progressStore.markBackfillComplete(conn, context.getSourceTable());
                return new ChunkResult(null, 0, true);
            }
            
            int copied;
            Array keyArray = conn.createArrayOf("bigint", keys.toArray());
            try (PreparedStatement stmt = conn.prepareStatement(copySql(context))) {
                stmt.setArray(1, keyArray);
                stmt.setLong(2, context.getSnapshotSequence());
                copied = stmt.executeUpdate();
            } finally {
                keyArray.free();
            }
            
            long lastKey = keys.get(keys.size() - 1);
            boolean complete = lastKey >= upperBound || keys.size() < chunkSize;
            progressStore.advanceCursor(conn, context.getSourceTable(), lastKey, complete);
            return new ChunkResult(lastKey, copied, complete);
        });
    }
    
    static String selectKeysSql(MigrationContext context, boolean hasCursor) {
        String key = context.getPrimaryKey().quotedName();
        return "SELECT " + key + " FROM " + context.getSourceTable().qualified()
            + " WHERE " + (hasCursor ? key + " > ? AND " : "") + key + " <= ?"
            + " ORDER BY " + key + " LIMIT ? FOR SHARE";
    }
    
    static String copySql(MigrationContext context) {
        String key = context.getPrimaryKey().quotedName();
        return "INSERT INTO " + context.getShadowTable().qualified()
            + " (" + context.getColumnMap().shadowColumnList() + ") OVERRIDING SYSTEM VALUE"
            + " SELECT " + context.getColumnMap().sourceColumnList("s")
            + " FROM " + context.getSourceTable().qualified() + " s"
            + " WHERE s." + key + " = ANY(?)"
            + " AND NOT EXISTS (SELECT 1 FROM " + context.getCaptureObjects().getLogTable().qualified() + " l"
            + " WHERE l." + ChangeCaptureInstaller.KEY_COLUMN + " = s." + key
            + " AND l." + ChangeCaptureInstaller.SEQUENCE_COLUMN + " > ?)"
            + " ON CONFLICT (" + key + ") DO NOTHING";
    }
    
    private static final class ChunkResult {
        final Long lastKey;
        final int rowsCopied;
        final boolean complete;
        
        ChunkResult(Long lastKey, int rowsCopied, boolean complete) {
            this.lastKey = lastKey;
            this.rowsCopied = rowsCopied;
            this.complete = complete;
        }
    }
}
