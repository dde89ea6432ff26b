package com.pgost.migration.cutover;

import com.pgost.migration.catalog.SequenceBinding;
import com.pgost.migration.model.TableName;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the swap transaction does, worked out from the catalog before the exclusive lock is taken.
 */
@Value
@Builder
public class SwapPlan {
    
    TableName sourceTable;
    TableName shadowTable;
    /** Where the source ends up, in the archive schema. */
    TableName archivedTable;
    
    /** Source sequences the shadow's column defaults still call; they move to the shadow's column. */
    @Singular
    List<Reown> reowns;
    
    /** Shadow sequences that must continue where the source's left off. */
    @Singular
    List<Seed> seeds;
    
    /** Source partitions, with the archived name each one gets. */
    @Singular
    List<Move> archivedPartitions;
    
    /** Shadow partitions, moved next to the promoted table under their own names. */
    @Singular
    List<Move> promotedPartitions;
    
    @Value
    public static class Reown {
        SequenceBinding sequence;
        String shadowColumn;
    }
    
    @Value
    public static class Seed {
        TableName shadowSequence;
        TableName sourceSequence;
    }
    
    @Value
    public static class Move {
        TableName from;
        TableName to;
    }
}
