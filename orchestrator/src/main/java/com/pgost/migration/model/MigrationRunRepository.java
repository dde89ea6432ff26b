package com.pgost.migration.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MigrationRunRepository extends JpaRepository<MigrationRun, Long> {
    
    /**
     * Find runs that have not reached a terminal state.
     */
    @Query("SELECT r FROM MigrationRun r WHERE r.status NOT IN " +
        "(com.pgost.migration.model.MigrationStatus.DONE, com.pgost.migration.model.MigrationStatus.ABORTED, " +
        "com.pgost.migration.model.MigrationStatus.REJECTED, com.pgost.migration.model.MigrationStatus.FAILED)")
    List<MigrationRun> findRunningRuns();
}
