package com.pgost.migration.ddl;

import com.pgost.migration.model.TableName;
import lombok.Value;

import java.util.List;

/**
 * Result of rewriting the user's DDL onto the shadow table: one CREATE TABLE statement
 * followed by the statements that finish the shadow (partitions, alters, indexes), in order.
 */
@Value
public class ShadowDefinition {
    TableName sourceTable;
    TableName shadowTable;
    String createTableStatement;
    List<String> followUpStatements;
    /** True when the shadow starts as a LIKE copy of the source rather than a user-supplied CREATE TABLE. */
    boolean clonedFromSource;
    
    /**
     * Partition tables created by the DDL, in the shadow schema.
     */
    List<TableName> partitions;
}
