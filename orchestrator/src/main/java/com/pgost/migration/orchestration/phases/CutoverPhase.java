package com.pgost.migration.orchestration.phases;

import com.pgost.migration.cutover.SwapCoordinator;
import com.pgost.migration.cutover.SwapPlan;
import com.pgost.migration.orchestration.MigrationContext;
import com.pgost.migration.orchestration.MigrationPhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Phase for swapping the shadow table in. Failures here are never rolled back automatically.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CutoverPhase implements MigrationPhase {
    
    private final SwapCoordinator swapCoordinator;
    
    @Override
    public void execute(MigrationContext context) throws Exception {
        SwapPlan plan = swapCoordinator.plan(context.getControlSession(), context);
        log.info("[Migration-{}] Swap plan: archive as {}, {} sequence re-own(s), {} sequence seed(s), {}/{} partition move(s)",
                context.getRunId(), plan.getArchivedTable(), plan.getReowns().size(), plan.getSeeds().size(),
                plan.getArchivedPartitions().size(), plan.getPromotedPartitions().size());
        
        context.setArchivedTable(swapCoordinator.swap(context.getControlSession(), context, plan));
    }
    
    @Override
    public boolean shouldSkip(MigrationContext context) {
        return context.isReplayOnly();
    }
    
    @Override
    public String getPhaseName() {
        return "Cutover";
    }
}
