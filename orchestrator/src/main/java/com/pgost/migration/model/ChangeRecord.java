package com.pgost.migration.model;

import lombok.Value;

/**
 * One captured mutation as read back from the log table.
 * Immutable; the row image is the JSON form of the source row (null for deletes).
 */
@Value
public class ChangeRecord {
    long sequenceId;
    ChangeOperation operation;
    long primaryKey;
    String rowImage;
}
