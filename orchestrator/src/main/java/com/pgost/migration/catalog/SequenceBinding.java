package com.pgost.migration.catalog;

import com.pgost.migration.model.TableName;
import lombok.Value;

/**
 * A sequence and the column it feeds.
 */
@Value
public class SequenceBinding {
    TableName sequence;
    String column;
}
