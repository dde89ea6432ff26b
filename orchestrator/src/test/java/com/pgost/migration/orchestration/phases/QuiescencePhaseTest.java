package com.pgost.migration.orchestration.phases;

import com.pgost.migration.TestContexts;
import com.pgost.migration.capture.ChangeCaptureInstaller;
import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.DataMigrationException;
import com.pgost.migration.exception.MigrationAbortedException;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationTeardown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuiescencePhaseTest {

    @Mock
    private ChangeCaptureInstaller captureInstaller;
    @Mock
    private MigrationTeardown teardown;

    private MigrationProperties properties;
    private QuiescencePhase phase;
    private MigrationContext context;

    @BeforeEach
    void setUp() {
        properties = new MigrationProperties();
        properties.getQuiescence().setStableWindowMs(0);
        properties.getQuiescence().setCheckIntervalMs(1);
        phase = new QuiescencePhase(properties, captureInstaller, teardown, Clock.systemUTC());
        context = TestContexts.accounts();
    }

    @Test
    void execute_shouldWaitForEmptyBacklogThenStopReplay() {
        when(captureInstaller.backlog(any(), any())).thenReturn(12L, 3L, 0L);
        when(teardown.stopReplayLoop(context)).thenReturn(true);

        assertThatCode(() -> phase.execute(context)).doesNotThrowAnyException();
        verify(captureInstaller, times(3)).backlog(any(), any());
        verify(teardown).stopReplayLoop(context);
    }

    @Test
    void execute_shouldGiveUpAfterTimeout() {
        properties.getQuiescence().setTimeoutMs(0);
        when(captureInstaller.backlog(any(), any())).thenReturn(40L);

        assertThatThrownBy(() -> phase.execute(context))
            .isInstanceOf(DataMigrationException.class)
            .hasMessageContaining("backlog 40");
        verifyNoInteractions(teardown);
    }

    @Test
    void execute_shouldStopOnAbort() {
        context.requestAbort();

        assertThatThrownBy(() -> phase.execute(context)).isInstanceOf(MigrationAbortedException.class);
        verifyNoInteractions(captureInstaller, teardown);
    }

    @Test
    void execute_shouldFailWhenReplayLoopDoesNotStop() {
        when(captureInstaller.backlog(any(), any())).thenReturn(0L);
        when(teardown.stopReplayLoop(context)).thenReturn(false);

        assertThatThrownBy(() -> phase.execute(context))
            .isInstanceOf(DataMigrationException.class)
            .hasMessageContaining("did not stop");
    }
}
