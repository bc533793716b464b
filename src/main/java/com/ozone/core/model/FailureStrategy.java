package com.ozone.core.model;

/**
 * What happens to a step once its retry policy is exhausted.
 */
public enum FailureStrategy {
    /** The step failure is terminal and the task moves to FAILED. */
    FAIL,
    /** A SKIPPED outcome is recorded and execution continues with the next step. */
    SKIP
}
