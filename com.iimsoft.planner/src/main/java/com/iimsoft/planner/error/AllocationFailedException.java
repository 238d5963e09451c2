package com.iimsoft.planner.error;

/**
 * Unexpected failure during a capacity or distribution run; the run produced no result.
 */
public class AllocationFailedException extends PlanningException {

    public AllocationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
