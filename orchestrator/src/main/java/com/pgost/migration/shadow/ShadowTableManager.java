package com.pgost.migration.shadow;

import com.pgost.migration.catalog.CatalogInspector;
import com.pgost.migration.ddl.ShadowDefinition;
import com.pgost.migration.exception.DatabaseOperationException;
import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.ColumnMap;
import com.pgost.migration.model.PrimaryKeyColumn;
import com.pgost.migration.model.TableName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Statement;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates, inspects and drops the shadow table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShadowTableManager {
    
    private final CatalogInspector catalog;
    
    public void ensureSchema(DatabaseSession session, String schema) {
        session.execute("CREATE SCHEMA IF NOT EXISTS " + TableName.quote(schema));
    }
    
    /**
     * Build the shadow in one transaction. DDL the server rejects is reported as a validation failure.
     */
    public void create(DatabaseSession session, ShadowDefinition definition) {
        log.info("Creating shadow table {}", definition.getShadowTable());
        try {
            session.inTransaction(conn -> {
                try (Statement stmt = conn.createStatement()) {
                    log.debug("  {}", definition.getCreateTableStatement());
                    stmt.execute(definition.getCreateTableStatement());
                    for (String statement : definition.getFollowUpStatements()) {
                        log.debug("  {}", statement);
                        stmt.execute(statement);
                    }
                }
                return null;
            });
        } catch (DatabaseOperationException e) {
            if (e.getSqlState() != null && (e.getSqlState().startsWith("42") || e.getSqlState().startsWith("22"))) {
                throw new ValidationException("Target DDL was rejected by the server: " + e.getMessage(), e);
            }
            throw e;
        }
        log.info("✓ Shadow table {} created", definition.getShadowTable());
    }
    
    public boolean exists(DatabaseSession session, TableName shadowTable) {
        return catalog.tableExists(session, shadowTable);
    }
    
    /**
     * Map source columns onto the shadow's writable columns and check the shadow can be keyed like the source.
     */
    public ColumnMap buildColumnMap(DatabaseSession session, TableName sourceTable, TableName shadowTable,
                                    PrimaryKeyColumn primaryKey) {
        List<String> sourceColumns = catalog.columns(session, sourceTable);
        List<String> writableSourceColumns = catalog.writableColumns(session, sourceTable);
        List<String> generatedSourceColumns = sourceColumns.stream()
            .filter(column -> !writableSourceColumns.contains(column))
            .collect(Collectors.toList());
        List<String> shadowColumns = catalog.writableColumns(session, shadowTable);
        ColumnMap columnMap = ColumnMap.between(sourceColumns, shadowColumns, generatedSourceColumns);
        
        if (!primaryKey.getName().equals(columnMap.shadowColumnFor(primaryKey.getName()))) {
            throw new ValidationException("Primary key column " + primaryKey.getName()
                + " must keep its name in the shadow table");
        }
        if (!catalog.hasUniqueIndexOn(session, shadowTable, primaryKey.getName())) {
            throw new ValidationException("Shadow table " + shadowTable + " has no primary key or unique index on "
                + primaryKey.getName());
        }
        if (!columnMap.droppedColumns().isEmpty()) {
            log.info("Columns not carried to the shadow table: {}", columnMap.droppedColumns());
        }
        log.info("Column map: {}", columnMap);
        return columnMap;
    }
    
    public void drop(DatabaseSession session, TableName shadowTable) {
        session.execute("DROP TABLE IF EXISTS " + shadowTable.qualified() + " CASCADE");
        log.info("Dropped shadow table {}", shadowTable);
    }
}
