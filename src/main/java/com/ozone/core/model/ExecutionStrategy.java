package com.ozone.core.model;

/**
 * Plan-level execution flag.
 * <p>
 * SEQUENTIAL: one step at a time, rank labels are ignored.
 * PARALLEL: adjacent steps sharing a rank label are dispatched concurrently.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL
}
