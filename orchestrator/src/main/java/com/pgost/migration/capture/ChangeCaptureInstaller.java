package com.pgost.migration.capture;

import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.PrimaryKeyColumn;
import com.pgost.migration.model.TableName;
import com.pgost.migration.util.RetryUtil;
import com.pgost.migration.util.SqlValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Statement;
import java.util.List;

/**
 * Installs and removes row-level change capture on a source table.
 * <p>
 * Every committed INSERT, UPDATE and DELETE on the source appends one record to the log table
 * in the same transaction, so the log's sequence order matches commit order for any one key.
 * An UPDATE that changes the key is logged as a DELETE of the old key followed by an UPDATE of the new one.
 * TRUNCATE is refused while capture is installed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeCaptureInstaller {
    
    public static final String SEQUENCE_COLUMN = "sequence_id";
    public static final String OPERATION_COLUMN = "operation";
    public static final String KEY_COLUMN = "row_key";
    public static final String IMAGE_COLUMN = "row_image";
    
    private final MigrationProperties properties;
    
    /**
     * Create the log table, trigger functions and triggers in one transaction.
     * Trigger creation briefly locks the source, so lock timeouts are retried.
     */
    public void install(DatabaseSession session, CaptureObjects objects, PrimaryKeyColumn primaryKey) {
        List<String> statements = installStatements(objects, primaryKey);
        
        RetryUtil.executeWithRetryVoid(() -> session.inTransaction(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("SET LOCAL lock_timeout = " + properties.getCutover().getLockTimeoutMs());
                for (String statement : statements) {
                    stmt.execute(statement);
                }
            }
            return null;
        }), properties.getRetry(), "install change capture on " + objects.getSourceTable());
        
        log.info("✓ Change capture installed on {} (log table {})", objects.getSourceTable(), objects.getLogTable());
    }
    
    /**
     * Drop triggers, functions and the log table. Safe to run repeatedly and after a partial install.
     * Dropping the functions with CASCADE removes their triggers wherever the table now lives.
     */
    public void uninstall(DatabaseSession session, CaptureObjects objects) {
        session.inTransaction(conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : uninstallStatements(objects)) {
                    stmt.execute(statement);
                }
            }
            return null;
        });
        log.info("✓ Change capture removed for {}", objects.getSourceTable());
    }
    
    /**
     * Number of captured changes not yet applied to the shadow.
     */
    public long backlog(DatabaseSession session, CaptureObjects objects) {
        Long count = session.queryForLong("SELECT count(*) FROM " + objects.getLogTable().qualified());
        return count == null ? 0 : count;
    }
    
    /**
     * Highest sequence ever handed out, or 0 before the first change.
     */
    public long lastSequence(DatabaseSession session, CaptureObjects objects) {
        Long value = session.queryForLong("SELECT coalesce(max(" + SEQUENCE_COLUMN + "), 0) FROM "
            + objects.getLogTable().qualified());
        return value == null ? 0 : value;
    }
    
    public boolean isInstalled(DatabaseSession session, CaptureObjects objects) {
        return session.queryForBoolean("SELECT to_regclass(?) IS NOT NULL", objects.getLogTable().qualified());
    }
    
    static List<String> installStatements(CaptureObjects objects, PrimaryKeyColumn primaryKey) {
        String log = objects.getLogTable().qualified();
        String source = objects.getSourceTable().qualified();
        String key = primaryKey.quotedName();
        
        String createLog = "CREATE TABLE IF NOT EXISTS " + log + " ("
            + SEQUENCE_COLUMN + " BIGSERIAL PRIMARY KEY, "
            + OPERATION_COLUMN + " TEXT NOT NULL, "
            + KEY_COLUMN + " " + primaryKey.getType().getSqlName() + " NOT NULL, "
            + IMAGE_COLUMN + " JSONB, "
            + "captured_at TIMESTAMPTZ NOT NULL DEFAULT now())";
        
        String createIndex = "CREATE INDEX IF NOT EXISTS "
            + TableName.quote(SqlValidator.suffixedIdentifier(objects.getLogTable().getName(), "_key_idx"))
            + " ON " + log + " (" + KEY_COLUMN + ", " + SEQUENCE_COLUMN + ")";
        
        String insertPrefix = "INSERT INTO " + log + " (" + OPERATION_COLUMN + ", " + KEY_COLUMN + ", " + IMAGE_COLUMN + ") VALUES ";
        String captureFunction = "CREATE OR REPLACE FUNCTION " + objects.getCaptureFunction().qualified() + "() "
            + "RETURNS trigger LANGUAGE plpgsql AS $pgost$\n"
            + "BEGIN\n"
            + "  IF TG_OP = 'DELETE' THEN\n"
            + "    " + insertPrefix + "('DELETE', OLD." + key + ", NULL);\n"
            + "    RETURN OLD;\n"
            + "  END IF;\n"
            + "  IF TG_OP = 'UPDATE' AND OLD." + key + " IS DISTINCT FROM NEW." + key + " THEN\n"
            + "    " + insertPrefix + "('DELETE', OLD." + key + ", NULL);\n"
            + "  END IF;\n"
            + "  " + insertPrefix + "(TG_OP, NEW." + key + ", to_jsonb(NEW));\n"
            + "  RETURN NEW;\n"
            + "END\n"
            + "$pgost$";
        
        String truncateGuard = "CREATE OR REPLACE FUNCTION " + objects.getTruncateGuardFunction().qualified() + "() "
            + "RETURNS trigger LANGUAGE plpgsql AS $pgost$\n"
            + "BEGIN\n"
            + "  RAISE EXCEPTION 'TRUNCATE of % is blocked while an online schema change is in progress', TG_TABLE_NAME;\n"
            + "END\n"
            + "$pgost$";
        
        return List.of(
            createLog,
            createIndex,
            captureFunction,
            truncateGuard,
            "DROP TRIGGER IF EXISTS " + CaptureObjects.INSERT_TRIGGER + " ON " + source,
            "DROP TRIGGER IF EXISTS " + CaptureObjects.UPDATE_TRIGGER + " ON " + source,
            "DROP TRIGGER IF EXISTS " + CaptureObjects.DELETE_TRIGGER + " ON " + source,
            "DROP TRIGGER IF EXISTS " + CaptureObjects.TRUNCATE_TRIGGER + " ON " + source,
            "CREATE TRIGGER " + CaptureObjects.INSERT_TRIGGER + " AFTER INSERT ON " + source
                + " FOR EACH ROW EXECUTE FUNCTION " + objects.getCaptureFunction().qualified() + "()",
            "CREATE TRIGGER " + CaptureObjects.UPDATE_TRIGGER + " AFTER UPDATE ON " + source
                + " FOR EACH ROW EXECUTE FUNCTION " + objects.getCaptureFunction().qualified() + "()",
            "CREATE TRIGGER " + CaptureObjects.DELETE_TRIGGER + " AFTER DELETE ON " + source
                + " FOR EACH ROW EXECUTE FUNCTION " + objects.getCaptureFunction().qualified() + "()",
            "CREATE TRIGGER " + CaptureObjects.TRUNCATE_TRIGGER + " BEFORE TRUNCATE ON " + source
                + " FOR EACH STATEMENT EXECUTE FUNCTION " + objects.getTruncateGuardFunction().qualified() + "()"
        );
    }
    
    public static List<String> uninstallStatements(CaptureObjects objects) {
        return List.of(
            "DROP FUNCTION IF EXISTS " + objects.getCaptureFunction().qualified() + "() CASCADE",
            "DROP FUNCTION IF EXISTS " + objects.getTruncateGuardFunction().qualified() + "() CASCADE",
            "DROP TABLE IF EXISTS " + objects.getLogTable().qualified()
        );
    }
}
