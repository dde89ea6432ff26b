package com.pgost.migration.orchestration.phases;

import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.DataMigrationException;
import com.pgost.migration.infrastructure.database.DatabaseConnectionFactory;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.MigrationStatus;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationPhase;
import com.pgost.migration.orchestration.MigrationTeardown;
import com.pgost.migration.progress.MigrationProgress;
import com.pgost.migration.progress.MigrationProgressStore;
import com.pgost.migration.replay.ReplayEngine;
import com.pgost.migration.replay.ReplayLoop;
import com.pgost.migration.shadow.ShadowTableManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Phase for creating the shadow table, installing change capture and starting replay.
 * Replay starts as soon as capture is live so the log never grows unattended.
 */
@Component
@Slf4j
public class CaptureInstallationPhase implements MigrationPhase {
    
    private final MigrationProperties properties;
    private final DatabaseConnectionFactory connectionFactory;
    private final ShadowTableManager shadowManager;
    private final ChangeCaptureInstaller captureInstaller;
    private final MigrationProgressStore progressStore;
    private final MigrationTeardown teardown;
    private final ReplayEngine replayEngine;
    private final TaskExecutor workerExecutor;
    
    public CaptureInstallationPhase(
            MigrationProperties properties,
            DatabaseConnectionFactory connectionFactory,
            ShadowTableManager shadowManager,
            ChangeCaptureInstaller captureInstaller,
            MigrationProgressStore progressStore,
            MigrationTeardown teardown,
            ReplayEngine replayEngine,
            @Qualifier("migrationWorkerExecutor") TaskExecutor workerExecutor) {
        this.properties = properties;
        this.connectionFactory = connectionFactory;
        this.shadowManager = shadowManager;
        this.captureInstaller = captureInstaller;
        this.progressStore = progressStore;
        this.teardown = teardown;
        this.replayEngine = replayEngine;
        this.workerExecutor = workerExecutor;
    }
    
    @Override
    public void execute(MigrationContext context) throws Exception {
        DatabaseSession control = context.getControlSession();
        
        shadowManager.ensureSchema(control, properties.getSchema().getShadowSchema());
        progressStore.ensureTable(control);
        
        if (context.isLeftoversFound()) {
            log.info("[Migration-{}] Clearing leftovers of an earlier run", context.getRunId());
            teardown.removeArtifacts(context);
        }
        
        if (!context.isResumed()) {
            progressStore.insert(control, MigrationProgress.builder()
                .sourceTable(context.getSourceTable().toString())
                .shadowTable(context.getShadowTable().toString())
                .logTable(context.getCaptureObjects().getLogTable().toString())
                .ddlDigest(context.getDdlDigest())
                .runId(context.getRunId())
                .phase(MigrationStatus.CAPTURE_INSTALLED.name())
                .build());
            shadowManager.create(control, context.getShadowDefinition());
        }
        
        context.setColumnMap(shadowManager.buildColumnMap(
            control, context.getSourceTable(), context.getShadowTable(), context.getPrimaryKey()));
        
        captureInstaller.install(control, context.getCaptureObjects(), context.getPrimaryKey());
        
        startReplayLoop(context);
    }
    
    private void startReplayLoop(MigrationContext context) {
        DatabaseSession replaySession = connectionFactory.openSession(context.getConnectionConfig(), "replay-" + context.getRunId());
        ReplayLoop loop = new ReplayLoop(replayEngine, replaySession, context, properties.getReplay().getPollIntervalMs());
        try {
            workerExecutor.execute(loop);
        } catch (TaskRejectedException e) {
            replaySession.close();
            throw new DataMigrationException("No worker thread available for the replay loop", e);
        }
        context.setReplayLoop(loop);
    }
    
    @Override
    public String getPhaseName() {
        return "Capture Installation";
    }
}
