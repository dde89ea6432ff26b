package com.pgost.migration.capture;

import com.pgost.migration.model.TableName;
import com.pgost.migration.util.SqlValidator;
import lombok.Value;

/**
 * Names of everything change capture creates for one source table.
 * The log table and trigger functions live in the shadow schema; the triggers live on the source.
 */
@Value
public class CaptureObjects {
    
    public static final String INSERT_TRIGGER = "pgost_capture_insert";
    public static final String UPDATE_TRIGGER = "pgost_capture_update";
    public static final String DELETE_TRIGGER = "pgost_capture_delete";
    public static final String TRUNCATE_TRIGGER = "pgost_block_truncate";
    
    TableName sourceTable;
    TableName logTable;
    TableName captureFunction;
    TableName truncateGuardFunction;
    
    public static CaptureObjects forSource(TableName sourceTable, String shadowSchema) {
        String base = sourceTable.getName();
        return new CaptureObjects(
            sourceTable,
            TableName.of(shadowSchema, SqlValidator.suffixedIdentifier(base, "_log")),
            TableName.of(shadowSchema, SqlValidator.suffixedIdentifier(base, "_capture")),
            TableName.of(shadowSchema, SqlValidator.suffixedIdentifier(base, "_truncate_guard"))
        );
    }
}
