package com.ozone.core.engine;

/**
 * Raised by a {@link Planner} that cannot decompose an objective, or when a
 * produced plan is structurally invalid.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
