package com.ozone.core.progress;

import com.ozone.core.model.ProgressView;
import com.ozone.core.model.StepOutcome;
import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;
import com.ozone.core.registry.TaskRegistry;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;

/**
 * Read-only progress views derived from registry state. Never mutates a task.
 */
@Service
public class ProgressReporter {

    private final TaskRegistry taskRegistry;

    public ProgressReporter(TaskRegistry taskRegistry) {
        this.taskRegistry = taskRegistry;
    }

    /**
     * @throws com.ozone.core.model.OrchestrationException NOT_FOUND when the task is unknown
     */
    public ProgressView report(UUID taskId) {
        return viewOf(taskRegistry.get(taskId));
    }

    public static ProgressView viewOf(Task task) {
        int total = task.totalSteps();
        double percent;
        if (task.state() == TaskState.COMPLETED) {
            percent = 100.0;
        } else if (total == 0) {
            percent = 0.0;
        } else {
            percent = 100.0 * task.cursor() / total;
        }
        return new ProgressView(task.id(), task.state(), task.cursor(), total, percent,
                task.lastOutcome(), task.pendingInterruption(), estimateRemaining(task), task.updatedAt());
    }

    /**
     * Mean successful attempt duration times the steps left, or null when nothing has
     * succeeded yet or the task is terminal.
     */
    static Duration estimateRemaining(Task task) {
        if (task.state().isTerminal()) {
            return null;
        }
        long count = 0;
        long totalMillis = 0;
        for (StepOutcome outcome : task.history()) {
            if (outcome.isSuccess()) {
                count++;
                totalMillis += outcome.duration().toMillis();
            }
        }
        if (count == 0) {
            return null;
        }
        int remaining = task.totalSteps() - task.cursor();
        return Duration.ofMillis(totalMillis / count * remaining);
    }
}
