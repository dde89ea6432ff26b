package com.pgost.migration.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception thrown when the table swap fails.
 * Always fatal: the migration ends in FAILED and an operator has to finish it by hand.
 */
@Getter
public class CutoverException extends MigrationException {
    
    private final List<String> completedSteps;
    private final String observedState;
    
    public CutoverException(String message, List<String> completedSteps, String observedState, Throwable cause) {
        super(message, cause);
        this.completedSteps = List.copyOf(completedSteps);
        this.observedState = observedState;
    }
    
    /**
     * Operator-facing description of what happened and how to finish the swap.
     */
    public String getRemediation() {
        return "Cutover failed after steps " + completedSteps + ". Observed state: " + observedState
            + ". Verify which table answers to the source name before dropping anything; "
            + "finish or revert the renames manually, then drop the change-capture triggers and log table.";
    }
}
