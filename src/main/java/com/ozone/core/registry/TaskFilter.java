package com.ozone.core.registry;

import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Predicate over task snapshots used by {@link TaskRegistry#list(TaskFilter)}.
 * An empty state set matches every task.
 */
public record TaskFilter(Set<TaskState> states) {

    public TaskFilter {
        states = states == null || states.isEmpty() ? Set.of() : Set.copyOf(states);
    }

    public static TaskFilter all() {
        return new TaskFilter(Set.of());
    }

    public static TaskFilter inState(TaskState first, TaskState... rest) {
        return new TaskFilter(EnumSet.of(first, rest));
    }

    public static TaskFilter terminal() {
        return new TaskFilter(EnumSet.of(TaskState.COMPLETED, TaskState.FAILED, TaskState.CANCELLED));
    }

    public boolean matches(Task task) {
        return states.isEmpty() || states.contains(task.state());
    }
}
