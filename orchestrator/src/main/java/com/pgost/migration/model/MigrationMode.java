package com.pgost.migration.model;

/**
 * What a run does once capture is installed.
 */
public enum MigrationMode {
    /** Backfill, replay, swap. */
    MIGRATE,
    /** Capture and replay only, until the operator stops it. No backfill, no cutover. */
    REPLAY_ONLY
}
