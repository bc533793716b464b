package com.ozone.core.engine;

import com.ozone.core.model.ExecutionStrategy;
import com.ozone.core.model.Plan;
import com.ozone.core.model.Step;
import com.ozone.core.model.Task;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Plan validation and rank boundaries.
 * <p>
 * Ranks are explicit: under PARALLEL, adjacent steps carrying the same rank label run
 * together. Under SEQUENTIAL every step is its own rank.
 */
final class RankResolver {

    private RankResolver() {}

    /** Half-open range of step indices {@code [start, end)} dispatched together. */
    record StepRange(int start, int end) {
        int size() {
            return end - start;
        }
    }

    /**
     * @throws PlanningException on empty plans, position gaps, duplicate step names,
     *         or a rank label reused for non-adjacent steps
     */
    static void validate(Plan plan) {
        List<Step> steps = plan.steps();
        if (steps.isEmpty()) {
            throw new PlanningException("Planner returned an empty plan");
        }
        var names = new HashSet<String>();
        var closedRanks = new HashSet<String>();
        String openRank = null;
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.id().position() != i) {
                throw new PlanningException("Step " + step.id() + " is at index " + i);
            }
            if (step.name() == null || step.name().isBlank()) {
                throw new PlanningException("Step at index " + i + " has no name");
            }
            if (!names.add(step.name())) {
                throw new PlanningException("Duplicate step name '" + step.name() + "'");
            }
            if (plan.strategy() != ExecutionStrategy.PARALLEL) {
                continue;
            }
            String rank = step.rank();
            if (!Objects.equals(rank, openRank)) {
                if (openRank != null) {
                    closedRanks.add(openRank);
                }
                if (rank != null && closedRanks.contains(rank)) {
                    throw new PlanningException("Rank '" + rank + "' is not contiguous (step " + step.id() + ")");
                }
                openRank = rank;
            }
        }
    }

    /**
     * The rank starting at the task's cursor.
     */
    static StepRange rankAt(Task task) {
        List<Step> plan = task.plan();
        int start = task.cursor();
        if (start >= plan.size()) {
            throw new IllegalStateException("Task " + task.id() + " has no steps left at cursor " + start);
        }
        String rank = plan.get(start).rank();
        int end = start + 1;
        if (task.strategy() == ExecutionStrategy.PARALLEL && rank != null) {
            while (end < plan.size() && rank.equals(plan.get(end).rank())) {
                end++;
            }
        }
        return new StepRange(start, end);
    }
}
