package com.iimsoft.planner.error;

/**
 * Unexpected failure during an optimization run; the run produced no result.
 */
public class OptimizationFailedException extends PlanningException {

    public OptimizationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
