package com.ozone.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of an orchestrated task.
 * <p>
 * {@link #COMPLETED}, {@link #FAILED} and {@link #CANCELLED} are terminal.
 */
public enum TaskState {
    PLANNING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether the state machine allows moving from this state to {@code target}.
     * Planning may fail directly when the planner errors.
     */
    public boolean canTransitionTo(TaskState target) {
        return allowedTargets().contains(target);
    }

    private Set<TaskState> allowedTargets() {
        return switch (this) {
            case PLANNING -> EnumSet.of(RUNNING, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(PAUSED, COMPLETED, FAILED, CANCELLED);
            case PAUSED -> EnumSet.of(RUNNING, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
