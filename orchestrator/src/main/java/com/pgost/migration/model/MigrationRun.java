package com.pgost.migration.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Audit record of one migration run.
 * Lives in the application's own database; resumption never reads it, it reads the
 * artifacts in the migrated database instead.
 */
@Entity
@Table(name = "migration_runs", indexes = {
    @Index(name = "idx_run_source_table", columnList = "sourceTable"),
    @Index(name = "idx_run_status", columnList = "status"),
    @Index(name = "idx_run_created_at", columnList = "createdAt")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MigrationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MigrationMode mode;

    /**
     * Database the run connects to, as host:port/database (no credentials).
     */
    @Column(nullable = false, length = 255)
    private String target;

    /**
     * Source table as schema.name, filled once the DDL has been parsed.
     */
    @Column(length = 255)
    private String sourceTable;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private MigrationStatus status;

    /**
     * Submitted DDL, kept for audit.
     */
    @Lob
    @Column(columnDefinition = "TEXT")
    private String ddl;

    /**
     * Last error message if the run failed or was aborted.
     */
    @Lob
    @Column(columnDefinition = "TEXT")
    private String lastError;

    /**
     * Last primary key copied by backfill, as of the latest status update.
     */
    private Long backfillCursor;

    /**
     * Highest change-log sequence applied by replay, as of the latest status update.
     */
    private Long replayWatermark;

    /**
     * Where the original table went after a successful swap.
     */
    @Column(length = 255)
    private String archivedTable;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;

    private Long executionTimeMs;

    /**
     * Get execution time as Duration.
     */
    @Transient
    public Duration getExecutionDuration() {
        if (executionTimeMs != null) {
            return Duration.ofMillis(executionTimeMs);
        }
        if (completedAt != null && createdAt != null) {
            return Duration.between(createdAt, completedAt);
        }
        if (createdAt != null) {
            return Duration.between(createdAt, LocalDateTime.now());
        }
        return Duration.ZERO;
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (status == null) {
            status = MigrationStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        
        // If status changed to terminal, set completedAt and calculate duration
        if (status != null && status.isTerminal() && completedAt == null) {
            completedAt = updatedAt;
            if (createdAt != null) {
                executionTimeMs = Duration.between(createdAt, completedAt).toMillis();
            }
        }
    }
}
