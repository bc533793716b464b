package com.ozone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot of an orchestrated task. Mutations go through the
 * {@code TaskRegistry}, which swaps snapshots under a per-task lock.
 *
 * @param id                  unique task identifier
 * @param objective           caller-supplied description
 * @param plan                ordered steps, fixed once planning completes
 * @param strategy            plan-level execution flag
 * @param state               current lifecycle state
 * @param cursor              index of the next step to execute
 * @param checkpoint          last resumption point written
 * @param pendingInterruption pause or cancel requested but not yet applied (nullable)
 * @param history             append-only step attempt log
 * @param interruptions       append-only interruption audit log
 * @param createdAt           creation time
 * @param updatedAt           last mutation time
 */
public record Task(
    UUID id,
    String objective,
    List<Step> plan,
    ExecutionStrategy strategy,
    TaskState state,
    int cursor,
    Checkpoint checkpoint,
    InterruptionType pendingInterruption,
    List<StepOutcome> history,
    List<Interruption> interruptions,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public Task {
        plan = plan == null ? List.of() : List.copyOf(plan);
        history = history == null ? List.of() : List.copyOf(history);
        interruptions = interruptions == null ? List.of() : List.copyOf(interruptions);
        if (strategy == null) {
            strategy = ExecutionStrategy.SEQUENTIAL;
        }
    }

    public static Task create(UUID id, String objective, Instant now) {
        return new Task(id, objective, List.of(), ExecutionStrategy.SEQUENTIAL, TaskState.PLANNING,
                0, Checkpoint.initial(now), null, List.of(), List.of(), now, now);
    }

    public int totalSteps() {
        return plan.size();
    }

    public boolean isFinished() {
        return cursor >= plan.size();
    }

    /** Most recent step outcome, or null when nothing has executed yet. */
    public StepOutcome lastOutcome() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public boolean hasTerminalFailure() {
        return history.stream().anyMatch(o -> o.isFailure() && o.terminal());
    }

    public Task withPlan(Plan newPlan) {
        return new Task(id, objective, newPlan.steps(), newPlan.strategy(), state, cursor, checkpoint,
                pendingInterruption, history, interruptions, createdAt, updatedAt);
    }

    /**
     * Returns this task in {@code target} state.
     *
     * @throws OrchestrationException INVALID_TRANSITION when the state machine forbids it
     */
    public Task transitionTo(TaskState target) {
        if (!state.canTransitionTo(target)) {
            throw OrchestrationException.invalidTransition(id, state, "transition to " + target + " for");
        }
        return new Task(id, objective, plan, strategy, target, cursor, checkpoint,
                pendingInterruption, history, interruptions, createdAt, updatedAt);
    }

    public Task withCursor(int newCursor) {
        if (newCursor < cursor || newCursor > plan.size()) {
            throw new IllegalArgumentException("cursor " + newCursor + " out of range [" + cursor + ", " + plan.size() + "]");
        }
        return new Task(id, objective, plan, strategy, state, newCursor, checkpoint,
                pendingInterruption, history, interruptions, createdAt, updatedAt);
    }

    public Task withCheckpoint(Checkpoint newCheckpoint) {
        return new Task(id, objective, plan, strategy, state, cursor, newCheckpoint,
                pendingInterruption, history, interruptions, createdAt, updatedAt);
    }

    public Task withPendingInterruption(InterruptionType pending) {
        return new Task(id, objective, plan, strategy, state, cursor, checkpoint,
                pending, history, interruptions, createdAt, updatedAt);
    }

    public Task appendOutcome(StepOutcome outcome) {
        var newHistory = new ArrayList<StepOutcome>(history.size() + 1);
        newHistory.addAll(history);
        newHistory.add(outcome);
        return new Task(id, objective, plan, strategy, state, cursor, checkpoint,
                pendingInterruption, newHistory, interruptions, createdAt, updatedAt);
    }

    public Task appendInterruption(Interruption interruption) {
        var newInterruptions = new ArrayList<Interruption>(interruptions.size() + 1);
        newInterruptions.addAll(interruptions);
        newInterruptions.add(interruption);
        return new Task(id, objective, plan, strategy, state, cursor, checkpoint,
                pendingInterruption, history, newInterruptions, createdAt, updatedAt);
    }

    public Task touchedAt(Instant now) {
        return new Task(id, objective, plan, strategy, state, cursor, checkpoint,
                pendingInterruption, history, interruptions, createdAt, now);
    }
}
