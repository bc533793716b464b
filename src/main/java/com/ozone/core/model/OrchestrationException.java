package com.ozone.core.model;

import java.util.UUID;

/**
 * Raised when an orchestration call violates a contract: unknown task, illegal
 * state transition, concurrent drive, unknown capability, and so on.
 * <p>
 * Ordinary provider failures never surface as this exception; they are recorded
 * as {@link StepOutcome} values instead.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorKind kind;

    public OrchestrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OrchestrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static OrchestrationException notFound(UUID taskId) {
        return new OrchestrationException(ErrorKind.NOT_FOUND, "Task not found: " + taskId);
    }

    public static OrchestrationException invalidTransition(UUID taskId, TaskState from, String operation) {
        return new OrchestrationException(ErrorKind.INVALID_TRANSITION,
                "Cannot " + operation + " task " + taskId + " in state " + from);
    }
}
