package com.pgost.migration.controller;

import com.pgost.migration.model.MigrationMode;
import com.pgost.migration.model.MigrationRequest;
import com.pgost.migration.model.MigrationRun;
import com.pgost.migration.service.MigrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for migration runs.
 * Exception handling is centralized in GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/migrations")
@RequiredArgsConstructor
@Slf4j
public class MigrationController {

    private final MigrationService migrationService;

    /**
     * Start an online schema change.
     * Returns immediately with the run; the migration runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<MigrationRun> startMigration(@Valid @RequestBody MigrationRequest request) {
        log.info("Received migration request against {}/{}",
                request.getConnection().getHost(), request.getConnection().getDatabase());
        
        MigrationRun run = migrationService.startMigration(request, MigrationMode.MIGRATE);
        
        log.info("Migration run created with ID: {}", run.getId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(run);
    }

    /**
     * Start capture and replay without backfill or cutover. Runs until aborted.
     */
    @PostMapping("/replay-only")
    public ResponseEntity<MigrationRun> startReplayOnly(@Valid @RequestBody MigrationRequest request) {
        log.info("Received replay-only request against {}/{}",
                request.getConnection().getHost(), request.getConnection().getDatabase());
        
        MigrationRun run = migrationService.startMigration(request, MigrationMode.REPLAY_ONLY);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(run);
    }

    /**
     * Get the status of a migration run.
     */
    @GetMapping("/{id}")
    public ResponseEntity<MigrationRun> getMigration(@PathVariable Long id) {
        log.debug("Getting status for run ID: {}", id);
        
        return migrationService.getRun(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Abort a run that has not reached cutover, or stop a replay-only run.
     */
    @PostMapping("/{id}/abort")
    public ResponseEntity<Map<String, Object>> abortMigration(@PathVariable Long id) {
        switch (migrationService.requestAbort(id)) {
            case ACCEPTED:
                return ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(Map.of("id", id, "message", "Abort requested"));
            case NOT_ABORTABLE:
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("id", id, "message", "Run is finished or already in cutover"));
            default:
                return ResponseEntity.notFound().build();
        }
    }
}
