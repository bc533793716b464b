package com.ozone.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * One dispatch to a capability provider within a task plan.
 *
 * @param id          position and stable name
 * @param capability  provider identifier, e.g. "code-analysis"
 * @param input       opaque payload handed to the provider
 * @param retryPolicy attempts and backoff for this step; null takes the configured default at planning
 * @param rank        explicit parallel rank label; null means the step stands alone
 * @param timeout     per-attempt timeout; null falls back to the configured default
 */
public record Step(
    StepId id,
    String capability,
    String input,
    RetryPolicy retryPolicy,
    String rank,
    Duration timeout
) implements Serializable {

    public Step {
        if (id == null) {
            throw new IllegalArgumentException("step id is required");
        }
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability is required for step " + id);
        }
    }

    public static Step of(int position, String name, String capability, String input) {
        return new Step(new StepId(position, name), capability, input, null, null, null);
    }

    public Step withRetryPolicy(RetryPolicy policy) {
        return new Step(id, capability, input, policy, rank, timeout);
    }

    public Step withRank(String rankLabel) {
        return new Step(id, capability, input, retryPolicy, rankLabel, timeout);
    }

    public Step withTimeout(Duration stepTimeout) {
        return new Step(id, capability, input, retryPolicy, rank, stepTimeout);
    }

    public String name() {
        return id.name();
    }
}
