package com.pgost.migration.model;

/**
 * Phase of a migration run. Runs move forward through the list; ABORTING/ABORTED is reachable
 * from every phase before CUTOVER, FAILED from anywhere.
 */
public enum MigrationStatus {
    // Initial state
    PENDING(false),
    
    // Validation, privilege checks and locking
    INIT(false),
    
    // Triggers and log table in place, shadow table created
    CAPTURE_INSTALLED(false),
    
    // Bulk copy running alongside replay
    BACKFILLING(false),
    
    // Backfill done, replay still draining (or replay-only mode)
    REPLAYING(false),
    
    // Waiting for the replay backlog to stay at zero
    QUIESCENCE_CHECK(false),
    
    // Swap in progress, abort no longer possible
    CUTOVER(false),
    
    // Removing capture artifacts after the swap (or at the end of a replay-only run)
    CLEANUP(false),
    
    // Terminal success state
    DONE(true),
    
    // Abort path
    ABORTING(false),
    ABORTED(true),
    
    // Rejected before any object was created
    REJECTED(true),
    
    // Needs operator attention
    FAILED(true);

    private final boolean terminal;

    MigrationStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
    
    /**
     * Process exit code for a run that ended in this status: 0 success, 2 user error,
     * 3 needs operator attention. Non-terminal statuses have no exit code.
     */
    public int getExitCode() {
        switch (this) {
            case DONE:
                return 0;
            case REJECTED:
                return 2;
            case ABORTED:
            case FAILED:
                return 3;
            default:
                throw new IllegalStateException("Status " + this + " is not terminal");
        }
    }

}
