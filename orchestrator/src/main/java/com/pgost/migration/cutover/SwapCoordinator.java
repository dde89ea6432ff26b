package com.pgost.migration.cutover;

import com.pgost.migration.catalog.CatalogInspector;
import com.pgost.migration.catalog.SequenceBinding;
import com.pgost.migration.config.MigrationProperties;
import com.pgost.migration.exception.CutoverException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.ColumnMap;
import com.pgost.migration.model.TableName;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.replay.ReplayEngine;
import com.pgost.migration.util.RetryUtil;
import com.pgost.migration.util.SqlValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Atomically replaces the source table with the shadow.
 * <p>
 * One transaction takes ACCESS EXCLUSIVE on the source (bounded by lock_timeout), applies whatever the
 * log still holds, hands sequences over, moves the source into the archive schema and the shadow into
 * the source's place. Readers and writers see either the old table or the new one, never neither.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SwapCoordinator {
    
    private static final DateTimeFormatter ARCHIVE_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");
    
    private final MigrationProperties properties;
    private final CatalogInspector catalog;
    private final ReplayEngine replayEngine;
    private final Clock clock;
    
    /**
     * Work out the swap from the catalog. Runs before the lock is taken.
     */
    public SwapPlan plan(DatabaseSession session, MigrationContext context) {
        TableName source = context.getSourceTable();
        TableName shadow = context.getShadowTable();
        ColumnMap columnMap = context.getColumnMap();
        String archiveSchema = properties.getSchema().getArchiveSchema();
        
        String suffix = "_" + LocalDateTime.now(clock).format(ARCHIVE_SUFFIX);
        TableName archived = archiveName(source, archiveSchema, suffix);
        for (int attempt = 2; catalog.tableExists(session, archived); attempt++) {
            archived = archiveName(source, archiveSchema, suffix + "_" + attempt);
        }
        
        SwapPlan.SwapPlanBuilder plan = SwapPlan.builder()
            .sourceTable(source)
            .shadowTable(shadow)
            .archivedTable(archived);
        
        List<SequenceBinding> sourceSequences = new ArrayList<>(catalog.sequences(session, source, 'a'));
        sourceSequences.addAll(catalog.sequences(session, source, 'i'));
        List<SequenceBinding> shadowSequences = new ArrayList<>(catalog.sequences(session, shadow, 'a'));
        shadowSequences.addAll(catalog.sequences(session, shadow, 'i'));
        Map<String, TableName> shadowSequenceByColumn = shadowSequences.stream()
            .collect(Collectors.toMap(SequenceBinding::getColumn, SequenceBinding::getSequence, (a, b) -> a));
        List<SequenceBinding> serialSequences = catalog.sequences(session, source, 'a');
        
        for (SequenceBinding binding : sourceSequences) {
            String shadowColumn = columnMap.shadowColumnFor(binding.getColumn());
            if (shadowColumn == null) {
                continue;
            }
            TableName shadowSequence = shadowSequenceByColumn.get(shadowColumn);
            if (shadowSequence != null) {
                plan.seed(new SwapPlan.Seed(shadowSequence, binding.getSequence()));
            } else if (serialSequences.contains(binding)) {
                // LIKE copies the nextval() default, so the shadow keeps calling the source's sequence
                plan.reown(new SwapPlan.Reown(binding, shadowColumn));
            }
        }
        
        for (TableName partition : catalog.partitions(session, source)) {
            plan.archivedPartition(new SwapPlan.Move(partition, archiveName(partition, archiveSchema, suffix)));
        }
        for (TableName partition : catalog.partitions(session, shadow)) {
            plan.promotedPartition(new SwapPlan.Move(partition, partition.inSchema(source.getSchema())));
        }
        return plan.build();
    }
    
    /**
     * Run the swap. Lock timeouts roll the whole transaction back and are retried; any other failure
     * is reported with the steps that ran and the state found afterwards.
     */
    public TableName swap(DatabaseSession session, MigrationContext context, SwapPlan plan) {
        List<String> steps = Collections.synchronizedList(new ArrayList<>());
        try {
            RetryUtil.executeWithRetryVoid(() -> {
                steps.clear();
                session.inTransaction(conn -> {
                    execute(conn, context, plan, steps);
                    return null;
                });
            }, properties.getRetry(), "swap " + plan.getSourceTable());
            steps.add("commit");
            
        } catch (RuntimeException e) {
            String observed = observeState(session, plan);
            log.error("[Migration-{}] Swap failed after steps {}: {}. Observed: {}",
                    context.getRunId(), steps, e.getMessage(), observed);
            throw new CutoverException("Swap of " + plan.getSourceTable() + " failed: " + e.getMessage(),
                steps, observed, e);
        }
        
        log.info("[Migration-{}] ✓ Swap committed: {} archived as {}", context.getRunId(),
                plan.getSourceTable(), plan.getArchivedTable());
        return plan.getArchivedTable();
    }
    
    private void execute(Connection conn, MigrationContext context, SwapPlan plan, List<String> steps) throws SQLException {
        TableName source = plan.getSourceTable();
        TableName archived = plan.getArchivedTable();
        
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("SET LOCAL lock_timeout = " + properties.getCutover().getLockTimeoutMs());
            stmt.execute("LOCK TABLE " + source.qualified() + " IN ACCESS EXCLUSIVE MODE");
            steps.add("lock " + source);
            
            long drained = replayEngine.drainInTransaction(conn, context);
            steps.add("final replay (" + drained + " change(s))");
            
            for (SwapPlan.Reown reown : plan.getReowns()) {
                stmt.execute("ALTER SEQUENCE " + reown.getSequence().getSequence().qualified() + " OWNED BY "
                    + plan.getShadowTable().qualified() + "." + TableName.quote(reown.getShadowColumn()));
            }
            for (SwapPlan.Seed seed : plan.getSeeds()) {
                try (PreparedStatement seedStmt = conn.prepareStatement("SELECT setval(?::regclass, last_value, is_called) FROM "
                        + seed.getSourceSequence().qualified())) {
                    seedStmt.setString(1, seed.getShadowSequence().qualified());
                    seedStmt.execute();
                }
            }
            steps.add("sequences");
            
            stmt.execute("CREATE SCHEMA IF NOT EXISTS " + TableName.quote(archived.getSchema()));
            for (SwapPlan.Move move : plan.getArchivedPartitions()) {
                moveTable(stmt, move.getFrom(), move.getTo());
            }
            moveTable(stmt, source, archived);
            steps.add("archive " + source + " as " + archived);
            
            for (SwapPlan.Move move : plan.getPromotedPartitions()) {
                moveTable(stmt, move.getFrom(), move.getTo());
            }
            moveTable(stmt, plan.getShadowTable(), source);
            steps.add("promote " + plan.getShadowTable() + " to " + source);
        }
    }
    
    /**
     * Rename within the current schema, then move. Either statement is skipped when it would be a no-op.
     */
    private static void moveTable(Statement stmt, TableName from, TableName to) throws SQLException {
        TableName current = from;
        if (!from.getName().equals(to.getName())) {
            stmt.execute("ALTER TABLE " + from.qualified() + " RENAME TO " + to.quotedName());
            current = from.renamed(to.getName());
        }
        if (!current.getSchema().equals(to.getSchema())) {
            stmt.execute("ALTER TABLE " + current.qualified() + " SET SCHEMA " + TableName.quote(to.getSchema()));
        }
    }
    
    private String observeState(DatabaseSession session, SwapPlan plan) {
        try {
            boolean sourcePresent = catalog.tableExists(session, plan.getSourceTable());
            boolean shadowPresent = catalog.tableExists(session, plan.getShadowTable());
            boolean archivePresent = catalog.tableExists(session, plan.getArchivedTable());
            return String.format("%s %s, %s %s, %s %s",
                plan.getSourceTable(), sourcePresent ? "present" : "missing",
                plan.getShadowTable(), shadowPresent ? "present" : "missing",
                plan.getArchivedTable(), archivePresent ? "present" : "missing");
        } catch (RuntimeException e) {
            log.warn("Could not inspect the catalog after the failed swap: {}", e.getMessage());
            return "unknown (catalog not reachable: " + e.getMessage() + ")";
        }
    }
    
    static TableName archiveName(TableName table, String archiveSchema, String suffix) {
        return TableName.of(archiveSchema, SqlValidator.suffixedIdentifier(table.getName(), suffix));
    }
}
