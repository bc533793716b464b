package com.ozone.core.events;

import com.ozone.core.model.TaskState;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kinds of execution events, each carrying the dotted name used on the SSE wire.
 */
public enum OzoneEventType {

    TASK_SUBMITTED("task.submitted"),
    TASK_RUNNING("task.running"),
    TASK_PAUSED("task.paused"),
    TASK_RESUMED("task.resumed"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed"),
    TASK_CANCELLED("task.cancelled"),
    /** Published once a terminal task has been removed from the registry. */
    TASK_EVICTED("task.evicted"),
    STEP_STARTED("step.started"),
    STEP_COMPLETED("step.completed"),
    STEP_FAILED("step.failed");

    private static final Map<String, OzoneEventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(OzoneEventType::wireName, Function.identity()));

    private final String wireName;

    OzoneEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** True for the event that closes a task's execution: completed, failed or cancelled. */
    public boolean isTerminal() {
        return this == TASK_COMPLETED || this == TASK_FAILED || this == TASK_CANCELLED;
    }

    public boolean isStepEvent() {
        return wireName.startsWith("step.");
    }

    /** A settled step attempt, as opposed to one just started. */
    public boolean isStepOutcome() {
        return this == STEP_COMPLETED || this == STEP_FAILED;
    }

    /**
     * The event announcing that a task entered {@code state}.
     *
     * @throws IllegalArgumentException for PLANNING, which is never announced
     */
    public static OzoneEventType forState(TaskState state) {
        return switch (state) {
            case RUNNING -> TASK_RUNNING;
            case PAUSED -> TASK_PAUSED;
            case COMPLETED -> TASK_COMPLETED;
            case FAILED -> TASK_FAILED;
            case CANCELLED -> TASK_CANCELLED;
            case PLANNING -> throw new IllegalArgumentException("No event announces " + state);
        };
    }

    public static Optional<OzoneEventType> fromWireName(String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
