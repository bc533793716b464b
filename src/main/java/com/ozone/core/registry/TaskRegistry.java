package com.ozone.core.registry;

import com.ozone.core.model.Task;

import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Thread-safe storage of task records.
 * <p>
 * Implementations guarantee that {@link #update} applies each mutator atomically
 * under an exclusive per-task lock, so a task has a single writer at a time while
 * unrelated tasks never contend. State machine rules are enforced by the mutators
 * themselves, not by the registry.
 */
public interface TaskRegistry {

    /**
     * Allocates a new task in PLANNING state.
     *
     * @throws com.ozone.core.model.OrchestrationException RESOURCE_EXHAUSTED when the registry is full
     */
    UUID createTask(String objective);

    /**
     * @throws com.ozone.core.model.OrchestrationException NOT_FOUND when absent
     */
    Task get(UUID taskId);

    Optional<Task> find(UUID taskId);

    /**
     * Applies {@code mutator} to the current snapshot under the task's exclusive lock
     * and stores the result.
     *
     * @return the stored snapshot after mutation
     * @throws com.ozone.core.model.OrchestrationException NOT_FOUND when absent; any exception
     *         thrown by the mutator propagates and leaves the task unchanged
     */
    Task update(UUID taskId, UnaryOperator<Task> mutator);

    /**
     * Lazily streams the ids of tasks matching {@code filter}. Each call starts a fresh
     * pass over live state; no snapshot isolation is offered across the whole stream.
     */
    Stream<UUID> list(TaskFilter filter);

    /**
     * Removes a task that has reached a terminal state.
     *
     * @return the evicted snapshot
     * @throws com.ozone.core.model.OrchestrationException NOT_FOUND when absent,
     *         INVALID_TRANSITION when the task is not terminal
     */
    Task evict(UUID taskId);

    int size();

    int capacity();
}
