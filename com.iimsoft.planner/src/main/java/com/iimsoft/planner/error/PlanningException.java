package com.iimsoft.planner.error;

/**
 * Base of every failure raised by the allocation engine.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
