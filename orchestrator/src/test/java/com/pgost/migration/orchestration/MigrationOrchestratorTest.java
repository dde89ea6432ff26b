package com.pgost.migration.orchestration;

import com.pgost.migration.TestContexts;
import com.pgost.migration.exception.AdvisoryLockLostException;
import com.pgost.migration.exception.CutoverException;
import com.pgost.migration.exception.DataMigrationException;
import com.pgost.migration.exception.MigrationException;
import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.model.MigrationMode;
import com.pgost.migration.model.MigrationStatus;
import com.pgost.migration.orchestration.phases.CaptureInstallationPhase;
import com.pgost.migration.orchestration.phases.CleanupPhase;
import com.pgost.migration.orchestration.phases.CutoverPhase;
import com.pgost.migration.orchestration.phases.DataSyncPhase;
import com.pgost.migration.orchestration.phases.InitPhase;
import com.pgost.migration.orchestration.phases.QuiescencePhase;
import com.pgost.migration.orchestration.phases.ReplayOnlyPhase;
import com.pgost.migration.progress.MigrationProgressStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MigrationOrchestratorTest {

    @Mock
    private InitPhase initPhase;
    @Mock
    private CaptureInstallationPhase captureInstallationPhase;
    @Mock
    private DataSyncPhase dataSyncPhase;
    @Mock
    private ReplayOnlyPhase replayOnlyPhase;
    @Mock
    private QuiescencePhase quiescencePhase;
    @Mock
    private CutoverPhase cutoverPhase;
    @Mock
    private CleanupPhase cleanupPhase;
    @Mock
    private MigrationTeardown teardown;
    @Mock
    private MigrationProgressStore progressStore;

    private MigrationOrchestrator orchestrator;
    private MigrationContext context;
    private final List<MigrationStatus> statuses = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        orchestrator = new MigrationOrchestrator(initPhase, captureInstallationPhase, dataSyncPhase, replayOnlyPhase,
            quiescencePhase, cutoverPhase, cleanupPhase, teardown, progressStore);
        context = TestContexts.accounts();
    }

    private MigrationStatus run() {
        return orchestrator.executeMigrationLifecycle(context, (status, error) -> {
            statuses.add(status);
            errors.add(error);
        });
    }

    @Test
    void executeMigrationLifecycle_shouldWalkEveryPhaseToDone() throws Exception {
        when(replayOnlyPhase.shouldSkip(context)).thenReturn(true);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.DONE);
        assertThat(statuses).containsExactly(
            MigrationStatus.INIT,
            MigrationStatus.CAPTURE_INSTALLED,
            MigrationStatus.BACKFILLING,
            MigrationStatus.REPLAYING,
            MigrationStatus.QUIESCENCE_CHECK,
            MigrationStatus.CUTOVER,
            MigrationStatus.CLEANUP,
            MigrationStatus.DONE);
        verify(cutoverPhase).execute(context);
        verify(replayOnlyPhase, never()).execute(any());
        verify(teardown, never()).removeArtifacts(any());
        verify(teardown).stopReplayLoop(context);
    }

    @Test
    void executeMigrationLifecycle_shouldRejectWhenInitFails() throws Exception {
        doThrow(new ValidationException("Table public.accounts has no primary key")).when(initPhase).execute(context);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.REJECTED);
        assertThat(errors).contains("Table public.accounts has no primary key");
        verify(captureInstallationPhase, never()).execute(any());
        verify(teardown, never()).removeArtifacts(any());
    }

    @Test
    void executeMigrationLifecycle_shouldAbortAndTearDownOnBackfillFailure() throws Exception {
        when(replayOnlyPhase.shouldSkip(context)).thenReturn(true);
        doThrow(new DataMigrationException("Replay loop failed")).when(dataSyncPhase).execute(context);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.ABORTED);
        assertThat(statuses).endsWith(MigrationStatus.ABORTING, MigrationStatus.ABORTED);
        verify(teardown).removeArtifacts(context);
        verify(quiescencePhase, never()).execute(any());
    }

    @Test
    void executeMigrationLifecycle_shouldRejectAfterTeardownWhenServerRefusesShadowDdl() throws Exception {
        doThrow(new ValidationException("Target DDL was rejected by the server")).when(captureInstallationPhase).execute(context);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.REJECTED);
        verify(teardown).removeArtifacts(context);
    }

    @Test
    void executeMigrationLifecycle_shouldWrapUnexpectedPhaseErrorsAndAbort() throws Exception {
        when(replayOnlyPhase.shouldSkip(context)).thenReturn(true);
        doThrow(new SQLException("connection reset", "08006")).when(quiescencePhase).execute(context);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.ABORTED);
        assertThat(errors.get(errors.size() - 1)).contains("connection reset");
    }

    @Test
    void executeMigrationLifecycle_shouldSkipCutoverWhenAbortWinsTheRace() throws Exception {
        when(replayOnlyPhase.shouldSkip(context)).thenReturn(true);
        doAnswer(invocation -> context.requestAbort()).when(quiescencePhase).execute(context);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.ABORTED);
        verify(cutoverPhase, never()).execute(any());
        verify(teardown).removeArtifacts(context);
    }

    @Test
    void executeMigrationLifecycle_shouldFailWithoutTeardownWhenSwapFails() throws Exception {
        when(replayOnlyPhase.shouldSkip(context)).thenReturn(true);
        CutoverException swapError = new CutoverException("Swap of public.accounts failed",
            List.of("lock public.accounts", "final replay (0 change(s))"), "public.accounts present", null);
        doThrow(swapError).when(cutoverPhase).execute(context);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.FAILED);
        assertThat(errors.get(errors.size() - 1))
            .startsWith(swapError.getRemediation())
            .contains("post_migrations.accounts_log grows with every write")
            .contains("DROP FUNCTION IF EXISTS \"post_migrations\".\"accounts_capture\"() CASCADE")
            .endsWith("DROP TABLE IF EXISTS \"post_migrations\".\"accounts_log\";");
        verify(teardown, never()).removeArtifacts(any());
        verify(cleanupPhase, never()).execute(any());
    }

    @Test
    void executeMigrationLifecycle_shouldLeaveArtifactsAloneWhenTableLockIsLost() throws Exception {
        context.setLockHeld(true);
        context.setAdvisoryLockKey("pgost:public.accounts");
        when(replayOnlyPhase.shouldSkip(context)).thenReturn(true);
        doThrow(new AdvisoryLockLostException("Advisory lock 'pgost:public.accounts' was released"))
            .when(dataSyncPhase).execute(context);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.FAILED);
        assertThat(statuses).doesNotContain(MigrationStatus.ABORTING);
        assertThat(errors.get(errors.size() - 1)).contains("Artifacts were left in place");
        assertThat(context.isLockHeld()).isFalse();
        verify(teardown, never()).removeArtifacts(any());
        verify(quiescencePhase, never()).execute(any());
    }

    @Test
    void executeMigrationLifecycle_shouldStopWhenTableLockIsLostWhileRecordingPhase() throws Exception {
        doThrow(new AdvisoryLockLostException("Advisory lock 'pgost:public.accounts' was released"))
            .when(progressStore).updatePhase(any(), any(), any(), any());

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.FAILED);
        verify(captureInstallationPhase, never()).execute(any());
        verify(teardown, never()).removeArtifacts(any());
    }

    @Test
    void executeMigrationLifecycle_shouldFailWhenTeardownIsIncomplete() throws Exception {
        when(replayOnlyPhase.shouldSkip(context)).thenReturn(true);
        doThrow(new DataMigrationException("Quiescence not reached")).when(quiescencePhase).execute(context);
        doThrow(new MigrationException("Teardown of public.accounts incomplete")).when(teardown).removeArtifacts(context);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.FAILED);
        assertThat(errors.get(errors.size() - 1)).contains("Quiescence not reached").contains("incomplete");
    }

    @Test
    void executeMigrationLifecycle_shouldEndReplayOnlyRunWithCleanup() throws Exception {
        context = new MigrationContext("run-2", TestContexts.request("ALTER TABLE accounts ADD COLUMN x int"),
            MigrationMode.REPLAY_ONLY);
        when(dataSyncPhase.shouldSkip(context)).thenReturn(true);

        MigrationStatus outcome = run();

        assertThat(outcome).isEqualTo(MigrationStatus.DONE);
        assertThat(statuses).containsExactly(
            MigrationStatus.INIT,
            MigrationStatus.CAPTURE_INSTALLED,
            MigrationStatus.REPLAYING,
            MigrationStatus.CLEANUP,
            MigrationStatus.DONE);
        verify(replayOnlyPhase).execute(context);
        verify(teardown).removeArtifacts(context);
        verify(quiescencePhase, never()).execute(any());
        verify(cutoverPhase, never()).execute(any());
    }
}
