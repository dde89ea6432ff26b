package com.pgost.migration.controller;

import com.pgost.migration.exception.ConcurrentMigrationException;
import com.pgost.migration.exception.GlobalExceptionHandler;
import com.pgost.migration.model.MigrationMode;
import com.pgost.migration.model.MigrationRun;
import com.pgost.migration.model.MigrationStatus;
import com.pgost.migration.service.MigrationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MigrationControllerTest {

    private static final String BODY = "{\"connection\": {\"host\": \"db\", \"port\": 5432, \"database\": \"app\","
        + " \"user\": \"app\", \"password\": \"secret\"},"
        + " \"sql\": \"ALTER TABLE accounts ADD COLUMN currency text DEFAULT 'USD'\"}";

    @Mock
    private MigrationService migrationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new MigrationController(migrationService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void startMigration_shouldAcceptAndReturnRun() throws Exception {
        MigrationRun run = MigrationRun.builder().id(5L).mode(MigrationMode.MIGRATE).status(MigrationStatus.PENDING).build();
        when(migrationService.startMigration(any(), eq(MigrationMode.MIGRATE))).thenReturn(run);

        mockMvc.perform(post("/migrations").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.id").value(5))
            .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void startMigration_shouldRejectRequestWithoutDdl() throws Exception {
        String body = BODY.replace("\"ALTER TABLE accounts ADD COLUMN currency text DEFAULT 'USD'\"", "\"\"");

        mockMvc.perform(post("/migrations").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fieldErrors.sql").exists());
        verifyNoInteractions(migrationService);
    }

    @Test
    void startReplayOnly_shouldReportTableAlreadyBeingMigrated() throws Exception {
        when(migrationService.startMigration(any(), eq(MigrationMode.REPLAY_ONLY)))
            .thenThrow(new ConcurrentMigrationException("Another migration holds public.accounts"));

        mockMvc.perform(post("/migrations/replay-only").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isConflict());
    }

    @Test
    void getMigration_shouldReturnNotFoundForUnknownRun() throws Exception {
        when(migrationService.getRun(42L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/migrations/42")).andExpect(status().isNotFound());
    }

    @Test
    void abortMigration_shouldMapAbortResults() throws Exception {
        when(migrationService.requestAbort(1L)).thenReturn(MigrationService.AbortResult.ACCEPTED);
        when(migrationService.requestAbort(2L)).thenReturn(MigrationService.AbortResult.NOT_ABORTABLE);
        when(migrationService.requestAbort(3L)).thenReturn(MigrationService.AbortResult.NOT_FOUND);

        mockMvc.perform(post("/migrations/1/abort")).andExpect(status().isAccepted());
        mockMvc.perform(post("/migrations/2/abort")).andExpect(status().isConflict());
        mockMvc.perform(post("/migrations/3/abort")).andExpect(status().isNotFound());
    }
}
