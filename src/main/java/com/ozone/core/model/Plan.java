package com.ozone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of a {@code Planner}: the ordered steps plus the plan-level execution flag.
 */
public record Plan(List<Step> steps, ExecutionStrategy strategy) implements Serializable {

    public Plan {
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (strategy == null) {
            strategy = ExecutionStrategy.SEQUENTIAL;
        }
    }

    public static Plan sequential(List<Step> steps) {
        return new Plan(steps, ExecutionStrategy.SEQUENTIAL);
    }

    public static Plan parallel(List<Step> steps) {
        return new Plan(steps, ExecutionStrategy.PARALLEL);
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
