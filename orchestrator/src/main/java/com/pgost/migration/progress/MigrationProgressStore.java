package com.pgost.migration.progress;

import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.ConcurrentMigrationException;
import com.pgost.migration.exception.DatabaseOperationException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.TableName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Reads and writes the progress table in the shadow schema.
 * Cursor and watermark updates take a {@link Connection} so they commit together with the
 * chunk or batch they describe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationProgressStore {
    
    public static final String TABLE_NAME = "migration_progress";
    
    private final MigrationProperties properties;
    
    public TableName table() {
        return TableName.of(properties.getSchema().getShadowSchema(), TABLE_NAME);
    }
    
    public void ensureTable(DatabaseSession session) {
        session.execute("CREATE TABLE IF NOT EXISTS " + table().qualified() + " ("
            + "source_table TEXT PRIMARY KEY, "
            + "shadow_table TEXT NOT NULL, "
            + "log_table TEXT NOT NULL, "
            + "ddl_digest TEXT NOT NULL, "
            + "run_id TEXT, "
            + "phase TEXT NOT NULL, "
            + "snapshot_max_pk BIGINT, "
            + "snapshot_sequence BIGINT, "
            + "backfill_cursor BIGINT, "
            + "backfill_complete BOOLEAN NOT NULL DEFAULT false, "
            + "replay_watermark BIGINT NOT NULL DEFAULT 0, "
            + "started_at TIMESTAMPTZ NOT NULL DEFAULT now(), "
            + "updated_at TIMESTAMPTZ NOT NULL DEFAULT now())");
    }
    
    /**
     * Register a new migration. A second row for the same source table means another run owns it.
     */
    public void insert(DatabaseSession session, MigrationProgress progress) {
        try {
            session.withConnection(conn -> {
                try (PreparedStatement stmt = conn.prepareStatement("INSERT INTO " + table().qualified()
                        + " (source_table, shadow_table, log_table, ddl_digest, run_id, phase) VALUES (?, ?, ?, ?, ?, ?)")) {
                    stmt.setString(1, progress.getSourceTable());
                    stmt.setString(2, progress.getShadowTable());
                    stmt.setString(3, progress.getLogTable());
                    stmt.setString(4, progress.getDdlDigest());
                    stmt.setString(5, progress.getRunId());
                    stmt.setString(6, progress.getPhase());
                    return stmt.executeUpdate();
                }
            });
        } catch (DatabaseOperationException e) {
            if ("23505".equals(e.getSqlState())) {
                throw new ConcurrentMigrationException("A migration of " + progress.getSourceTable() + " is already recorded");
            }
            throw e;
        }
    }
    
    public Optional<MigrationProgress> load(DatabaseSession session, TableName sourceTable) {
        if (!session.queryForBoolean("SELECT to_regclass(?) IS NOT NULL", table().qualified())) {
            return Optional.empty();
        }
        return session.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT shadow_table, log_table, ddl_digest, run_id, phase, "
                    + "snapshot_max_pk, snapshot_sequence, backfill_cursor, backfill_complete, replay_watermark, "
                    + "started_at, updated_at FROM " + table().qualified() + " WHERE source_table = ?")) {
                stmt.setString(1, sourceTable.toString());
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(MigrationProgress.builder()
                        .sourceTable(sourceTable.toString())
                        .shadowTable(rs.getString(1))
                        .logTable(rs.getString(2))
                        .ddlDigest(rs.getString(3))
                        .runId(rs.getString(4))
                        .phase(rs.getString(5))
                        .snapshotMaxPk(nullableLong(rs, 6))
                        .snapshotSequence(nullableLong(rs, 7))
                        .backfillCursor(nullableLong(rs, 8))
                        .backfillComplete(rs.getBoolean(9))
                        .replayWatermark(rs.getLong(10))
                        .startedAt(rs.getObject(11, OffsetDateTime.class))
                        .updatedAt(rs.getObject(12, OffsetDateTime.class))
                        .build());
                }
            }
        });
    }
    
    public void updatePhase(DatabaseSession session, TableName sourceTable, String runId, String phase) {
        session.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("UPDATE " + table().qualified()
                    + " SET phase = ?, run_id = ?, updated_at = now() WHERE source_table = ?")) {
                stmt.setString(1, phase);
                stmt.setString(2, runId);
                stmt.setString(3, sourceTable.toString());
                return stmt.executeUpdate();
            }
        });
    }
    
    /**
     * Record the backfill snapshot. Runs once per migration; a resumed run keeps the first snapshot.
     */
    public void recordSnapshot(DatabaseSession session, TableName sourceTable, Long snapshotMaxPk, long snapshotSequence) {
        session.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("UPDATE " + table().qualified()
                    + " SET snapshot_max_pk = ?, snapshot_sequence = ?, backfill_complete = ?, updated_at = now() "
                    + "WHERE source_table = ? AND snapshot_sequence IS NULL")) {
                if (snapshotMaxPk == null) {
                    stmt.setNull(1, Types.BIGINT);
                } else {
                    stmt.setLong(1, snapshotMaxPk);
                }
                stmt.setLong(2, snapshotSequence);
                stmt.setBoolean(3, snapshotMaxPk == null);
                stmt.setString(4, sourceTable.toString());
                return stmt.executeUpdate();
            }
        });
    }
    
    public void advanceCursor(Connection conn, TableName sourceTable, long cursor, boolean complete) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("UPDATE " + table().qualified()
                + " SET backfill_cursor = ?, backfill_complete = ?, updated_at = now() WHERE source_table = ?")) {
            stmt.setLong(1, cursor);
            stmt.setBoolean(2, complete);
            stmt.setString(3, sourceTable.toString());
            stmt.executeUpdate();
        }
    }
    
    public void markBackfillComplete(Connection conn, TableName sourceTable) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("UPDATE " + table().qualified()
                + " SET backfill_complete = true, updated_at = now() WHERE source_table = ?")) {
            stmt.setString(1, sourceTable.toString());
            stmt.executeUpdate();
        }
    }
    
    public void advanceWatermark(Connection conn, TableName sourceTable, long sequence) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("UPDATE " + table().qualified()
                + " SET replay_watermark = GREATEST(replay_watermark, ?), updated_at = now() WHERE source_table = ?")) {
            stmt.setLong(1, sequence);
            stmt.setString(2, sourceTable.toString());
            stmt.executeUpdate();
        }
    }
    
    public void delete(DatabaseSession session, TableName sourceTable) {
        if (!session.queryForBoolean("SELECT to_regclass(?) IS NOT NULL", table().qualified())) {
            return;
        }
        session.withConnection(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM " + table().qualified() + " WHERE source_table = ?")) {
                stmt.setString(1, sourceTable.toString());
                return stmt.executeUpdate();
            }
        });
        log.debug("Removed progress row for {}", sourceTable);
    }
    
    /**
     * Fingerprint of the target DDL, insensitive to whitespace differences.
     */
    public static String digest(String ddl) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(StringUtils.normalizeSpace(ddl).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
    
    private static Long nullableLong(ResultSet rs, int column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
