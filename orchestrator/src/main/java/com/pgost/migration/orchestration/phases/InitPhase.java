package com.pgost.migration.orchestration.phases;

import com.pgost.migration.capture.CaptureObjects;
import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.catalog.CatalogInspector;
import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.ddl.ShadowDdlRewriter;
import com.pgost.migration.ddl.ShadowDefinition;
import com.pgost.migration.exception.ConcurrentMigrationException;
import com.pgost.migration.exception.ConfigurationException;
import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.infrastructure.database.DatabaseConnectionFactory;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.TableName;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationPhase;
import com.pgost.migration.progress.MigrationProgress;
import com.pgost.migration.progress.MigrationProgressStore;
import com.pgost.migration.shadow.ShadowTableManager;
import com.pgost.migration.util.SqlValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Phase for validating the request and claiming the source table.
 * Creates nothing in the target database; every failure here leaves it untouched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InitPhase implements MigrationPhase {
    
    private final MigrationProperties properties;
    private final DatabaseConnectionFactory connectionFactory;
    private final ShadowDdlRewriter ddlRewriter;
    private final CatalogInspector catalog;
    private final ShadowTableManager shadowManager;
    private final ChangeCaptureInstaller captureInstaller;
    private final MigrationProgressStore progressStore;
    
    @Override
    public void execute(MigrationContext context) throws Exception {
        String shadowSchema = properties.getSchema().getShadowSchema();
        String archiveSchema = properties.getSchema().getArchiveSchema();
        SqlValidator.validateSchemaName(shadowSchema);
        SqlValidator.validateSchemaName(archiveSchema);
        if (shadowSchema.equals(archiveSchema)) {
            throw new ConfigurationException("Shadow and archive schema must differ, both are " + shadowSchema);
        }
        
        ShadowDefinition definition = ddlRewriter.rewrite(
            context.getRequest().getSql(), context.getConnectionConfig().getSchemaOrDefault(), shadowSchema);
        TableName source = definition.getSourceTable();
        if (source.getSchema().equals(shadowSchema) || source.getSchema().equals(archiveSchema)) {
            throw new ValidationException("Tables in " + source.getSchema() + " are managed by the migration tool itself");
        }
        
        context.setShadowDefinition(definition);
        context.setSourceTable(source);
        context.setShadowTable(definition.getShadowTable());
        context.setCaptureObjects(CaptureObjects.forSource(source, shadowSchema));
        context.setDdlDigest(MigrationProgressStore.digest(context.getRequest().getSql()));
        log.info("[Migration-{}] Source table {}, shadow table {}", context.getRunId(), source, definition.getShadowTable());
        
        DatabaseSession control = connectionFactory.openSession(context.getConnectionConfig(), "control-" + context.getRunId());
        context.setControlSession(control);
        
        int version = catalog.serverVersion(control);
        if (version < CatalogInspector.MINIMUM_SERVER_VERSION) {
            throw new ConfigurationException("PostgreSQL " + version + " is not supported; version 11 or newer is required");
        }
        if (!catalog.tableExists(control, source)) {
            throw new ValidationException("Table " + source + " does not exist");
        }
        if (!catalog.hasCreatePrivilege(control)) {
            throw new ConfigurationException("User " + context.getConnectionConfig().getUser()
                + " lacks CREATE privilege on database " + context.getConnectionConfig().getDatabase());
        }
        if (!catalog.hasTriggerPrivilege(control, source)) {
            throw new ConfigurationException("User " + context.getConnectionConfig().getUser()
                + " lacks TRIGGER privilege on " + source);
        }
        context.setPrimaryKey(catalog.primaryKey(control, source));
        
        String lockKey = "pgost:" + source;
        if (!control.tryAdvisoryLock(lockKey)) {
            throw new ConcurrentMigrationException("Another migration of " + source + " is in progress");
        }
        context.setAdvisoryLockKey(lockKey);
        context.setLockHeld(true);
        log.info("[Migration-{}] ✓ Advisory lock '{}' acquired", context.getRunId(), lockKey);
        
        detectEarlierRun(control, context);
    }
    
    private void detectEarlierRun(DatabaseSession control, MigrationContext context) {
        Optional<MigrationProgress> existing = progressStore.load(control, context.getSourceTable());
        boolean shadowExists = shadowManager.exists(control, context.getShadowTable());
        boolean logExists = captureInstaller.isInstalled(control, context.getCaptureObjects());
        
        if (existing.isEmpty()) {
            if (shadowExists || logExists) {
                log.warn("[Migration-{}] Found shadow/log tables without a progress record; they will be cleared",
                        context.getRunId());
                context.setLeftoversFound(true);
            }
            return;
        }
        
        MigrationProgress progress = existing.get();
        if (!progress.getDdlDigest().equals(context.getDdlDigest())) {
            throw new ValidationException("An earlier migration of " + context.getSourceTable()
                + " with different DDL was interrupted (phase " + progress.getPhase()
                + "); re-submit its original DDL and abort it first");
        }
        if (!shadowExists || !logExists) {
            log.warn("[Migration-{}] Earlier run stopped before its shadow and log were both in place; starting over",
                    context.getRunId());
            context.setLeftoversFound(true);
            return;
        }
        
        context.setResumed(true);
        context.setReplayWatermark(progress.getReplayWatermark());
        context.setBackfillCursor(progress.getBackfillCursor());
        context.setBackfillComplete(progress.isBackfillComplete());
        if (progress.hasSnapshot()) {
            context.setSnapshotTaken(true);
            context.setSnapshotMaxPk(progress.getSnapshotMaxPk());
            context.setSnapshotSequence(progress.getSnapshotSequence());
        }
        log.info("[Migration-{}] Resuming earlier run {} from phase {} (cursor={}, watermark={})",
                context.getRunId(), progress.getRunId(), progress.getPhase(),
                progress.getBackfillCursor(), progress.getReplayWatermark());
    }
    
    @Override
    public String getPhaseName() {
        return "Init";
    }
}
