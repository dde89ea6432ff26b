package com.pgost.migration.replay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.DataMigrationException;
import com.pgost.migration.exception.DatabaseOperationException;
import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.infrastructure.database.SqlErrorClassifier;
import com.pgost.migration.model.ChangeOperation;
import com.pgost.migration.model.ChangeRecord;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.progress.MigrationProgressStore;
import com.pgost.migration.util.RetryUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies captured changes to the shadow table.
 * <p>
 * A batch is consumed (deleted from the log) in the same transaction that applies it, so every record
 * is applied exactly once even when sequence numbers commit out of order. Within a batch only the
 * latest record per key matters: every touched key is deleted from the shadow and the keys whose
 * latest record carries a row image are inserted again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplayEngine {
    
    private final MigrationProperties properties;
    private final MigrationProgressStore progressStore;
    private final ObjectMapper objectMapper;
    
    /**
     * Apply one batch in its own transaction, retrying transient failures.
     *
     * @return number of log records consumed; 0 when the log was empty
     */
    public int applyBatch(DatabaseSession session, MigrationContext context) {
        try {
            return RetryUtil.executeWithRetry(
                () -> session.inTransaction(conn -> applyBatch(conn, context)),
                properties.getRetry(),
                "replay batch for " + context.getSourceTable(),
                context::isAbortRequested);
        } catch (DatabaseOperationException e) {
            if (SqlErrorClassifier.isConstraintViolation(e)) {
                throw new ValidationException("Changes written to " + context.getSourceTable()
                    + " violate a constraint of the new table definition: " + e.getMessage(), e);
            }
            throw e;
        }
    }
    
    /**
     * Apply batches until the log is empty or an abort is requested.
     *
     * @return total records consumed
     */
    public long drain(DatabaseSession session, MigrationContext context) {
        long total = 0;
        int applied;
        do {
            applied = applyBatch(session, context);
            total += applied;
        } while (applied > 0 && !context.isAbortRequested());
        return total;
    }
    
    /**
     * Apply everything left in the log on an existing transaction. Used by the swap, which already
     * holds the exclusive lock on the source so no new records can appear.
     */
    public long drainInTransaction(Connection conn, MigrationContext context) throws SQLException {
        long total = 0;
        int applied;
        do {
            applied = applyBatch(conn, context);
            total += applied;
        } while (applied > 0);
        return total;
    }
    
    int applyBatch(Connection conn, MigrationContext context) throws SQLException {
        List<ChangeRecord> records = consumeBatch(conn, context, properties.getReplay().getBatchSize());
        if (records.isEmpty()) {
            return 0;
        }
        
        Collection<ChangeRecord> latest = latestPerKey(records);
        
        Array keyArray = conn.createArrayOf("bigint", latest.stream().map(ChangeRecord::getPrimaryKey).toArray());
        try (PreparedStatement stmt = conn.prepareStatement(deleteSql(context))) {
            stmt.setArray(1, keyArray);
            stmt.executeUpdate();
        } finally {
            keyArray.free();
        }
        
        String images = rowImageArray(latest);
        if (images != null) {
            try (PreparedStatement stmt = conn.prepareStatement(insertSql(context))) {
                stmt.setString(1, images);
                stmt.executeUpdate();
            }
        }
        
        long maxSequence = records.get(records.size() - 1).getSequenceId();
        progressStore.advanceWatermark(conn, context.getSourceTable(), maxSequence);
        context.setReplayWatermark(Math.max(context.getReplayWatermark(), maxSequence));
        context.setChangesApplied(context.getChangesApplied() + records.size());
        
        log.debug("[Migration-{}] Replayed {} change(s) over {} key(s), watermark {}",
                context.getRunId(), records.size(), latest.size(), maxSequence);
        return records.size();
    }
    
    private List<ChangeRecord> consumeBatch(Connection conn, MigrationContext context, int batchSize) throws SQLException {
        List<ChangeRecord> records = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(consumeSql(context))) {
            stmt.setInt(1, batchSize);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(new ChangeRecord(
                        rs.getLong(1),
                        ChangeOperation.valueOf(rs.getString(2)),
                        rs.getLong(3),
                        rs.getString(4)));
                }
            }
        }
        // RETURNING does not guarantee order
        records.sort(Comparator.comparingLong(ChangeRecord::getSequenceId));
        return records;
    }
    
    /**
     * Keep the highest-sequence record per key; input must be in sequence order.
     */
    static Collection<ChangeRecord> latestPerKey(List<ChangeRecord> records) {
        Map<Long, ChangeRecord> latest = new LinkedHashMap<>();
        for (ChangeRecord record : records) {
            latest.remove(record.getPrimaryKey());
            latest.put(record.getPrimaryKey(), record);
        }
        return latest.values();
    }
    
    /**
     * JSON array of the row images to re-insert, or null when every touched key ended deleted.
     */
    String rowImageArray(Collection<ChangeRecord> latest) {
        ArrayNode array = objectMapper.createArrayNode();
        try {
            for (ChangeRecord record : latest) {
                if (record.getOperation().carriesRowImage() && record.getRowImage() != null) {
                    array.add(objectMapper.readTree(record.getRowImage()));
                }
            }
            return array.isEmpty() ? null : objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new DataMigrationException("Captured row image is not valid JSON", e);
        }
    }
    
    static String consumeSql(MigrationContext context) {
        String log = context.getCaptureObjects().getLogTable().qualified();
        String seq = ChangeCaptureInstaller.SEQUENCE_COLUMN;
        return "DELETE FROM " + log + " WHERE " + seq + " IN ("
            + "SELECT " + seq + " FROM " + log + " ORDER BY " + seq + " LIMIT ? FOR UPDATE SKIP LOCKED)"
            + " RETURNING " + seq + ", " + ChangeCaptureInstaller.OPERATION_COLUMN + ", "
            + ChangeCaptureInstaller.KEY_COLUMN + ", " + ChangeCaptureInstaller.IMAGE_COLUMN + "::text";
    }
    
    static String deleteSql(MigrationContext context) {
        return "DELETE FROM " + context.getShadowTable().qualified()
            + " WHERE " + context.getPrimaryKey().quotedName() + " = ANY(?)";
    }
    
    static String insertSql(MigrationContext context) {
        return "INSERT INTO " + context.getShadowTable().qualified()
            + " (" + context.getColumnMap().shadowColumnList() + ") OVERRIDING SYSTEM VALUE"
            + " SELECT " + context.getColumnMap().sourceColumnList("r")
            + " FROM jsonb_populate_recordset(NULL::" + context.getSourceTable().qualified() + ", ?::jsonb) r";
    }
}
