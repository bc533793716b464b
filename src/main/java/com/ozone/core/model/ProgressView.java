package com.ozone.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only progress snapshot derived from registry state.
 *
 * @param taskId              the task
 * @param state               lifecycle state
 * @param cursor              next step index
 * @param totalSteps          plan length
 * @param percentComplete     cursor / totalSteps as a percentage (100 once completed)
 * @param lastOutcome         most recent step attempt (nullable)
 * @param pendingInterruption requested pause or cancel not yet applied (nullable)
 * @param estimatedRemaining  remaining time estimate from past step durations (nullable)
 * @param updatedAt           last task mutation time
 */
public record ProgressView(
    UUID taskId,
    TaskState state,
    int cursor,
    int totalSteps,
    double percentComplete,
    StepOutcome lastOutcome,
    InterruptionType pendingInterruption,
    Duration estimatedRemaining,
    Instant updatedAt
) implements Serializable {}
