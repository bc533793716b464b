package com.ozone.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Immutable record of one step attempt, appended to the task history.
 *
 * @param stepId        the step this attempt belongs to
 * @param attemptNumber 1-based attempt counter
 * @param status        SUCCESS, FAILURE or SKIPPED
 * @param output        provider output (SUCCESS only)
 * @param errorKind     failure kind (FAILURE only)
 * @param error         human-readable failure detail (FAILURE and SKIPPED)
 * @param terminal      true on the last failure of a step whose policy fails the task
 * @param startedAt     when the attempt was dispatched
 * @param finishedAt    when the attempt settled
 */
public record StepOutcome(
    StepId stepId,
    int attemptNumber,
    Status status,
    String output,
    ErrorKind errorKind,
    String error,
    boolean terminal,
    Instant startedAt,
    Instant finishedAt
) implements Serializable {

    public enum Status { SUCCESS, FAILURE, SKIPPED }

    public static StepOutcome success(StepId stepId, int attempt, String output,
                                      Instant startedAt, Instant finishedAt) {
        return new StepOutcome(stepId, attempt, Status.SUCCESS, output, null, null, false, startedAt, finishedAt);
    }

    public static StepOutcome failure(StepId stepId, int attempt, ErrorKind kind, String error,
                                      boolean terminal, Instant startedAt, Instant finishedAt) {
        return new StepOutcome(stepId, attempt, Status.FAILURE, null, kind, error, terminal, startedAt, finishedAt);
    }

    public static StepOutcome skipped(StepId stepId, int attempt, String reason, Instant at) {
        return new StepOutcome(stepId, attempt, Status.SKIPPED, null, null, reason, false, at, at);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    /** A step is settled once it succeeded, was skipped, or failed terminally. */
    public boolean isSettled() {
        return status != Status.FAILURE || terminal;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
