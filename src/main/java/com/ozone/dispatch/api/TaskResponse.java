package com.ozone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ozone.core.model.Interruption;
import com.ozone.core.model.Step;
import com.ozone.core.model.StepOutcome;
import com.ozone.core.model.Task;

import java.util.List;

/**
 * JSON response for task endpoints.
 */
public record TaskResponse(
    @JsonProperty("task_id") String taskId,
    String objective,
    String state,
    String strategy,
    int cursor,
    @JsonProperty("total_steps") int totalSteps,
    @JsonProperty("pending_interruption") String pendingInterruption,
    List<StepResponse> steps,
    List<OutcomeResponse> history,
    List<InterruptionResponse> interruptions,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt
) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id().toString(),
                task.objective(),
                task.state().name(),
                task.strategy().name(),
                task.cursor(),
                task.totalSteps(),
                task.pendingInterruption() != null ? task.pendingInterruption().name() : null,
                task.plan().stream().map(StepResponse::from).toList(),
                task.history().stream().map(OutcomeResponse::from).toList(),
                task.interruptions().stream().map(InterruptionResponse::from).toList(),
                String.valueOf(task.createdAt()),
                String.valueOf(task.updatedAt()));
    }

    /**
     * Compact representation used by the task list.
     */
    public record Summary(
        @JsonProperty("task_id") String taskId,
        String objective,
        String state,
        int cursor,
        @JsonProperty("total_steps") int totalSteps,
        @JsonProperty("updated_at") String updatedAt
    ) {
        public static Summary from(Task task) {
            return new Summary(task.id().toString(), task.objective(), task.state().name(),
                    task.cursor(), task.totalSteps(), String.valueOf(task.updatedAt()));
        }
    }

    public record StepResponse(
        int position,
        String name,
        String capability,
        String input,
        String rank,
        @JsonProperty("max_attempts") int maxAttempts,
        @JsonProperty("on_exhausted") String onExhausted,
        @JsonProperty("timeout_ms") Long timeoutMs
    ) {
        static StepResponse from(Step step) {
            var policy = step.retryPolicy();
            return new StepResponse(
                    step.id().position(),
                    step.name(),
                    step.capability(),
                    step.input(),
                    step.rank(),
                    policy != null ? policy.maxAttempts() : 1,
                    policy != null ? policy.onExhausted().name() : null,
                    step.timeout() != null ? step.timeout().toMillis() : null);
        }
    }

    public record OutcomeResponse(
        @JsonProperty("step_id") String stepId,
        int attempt,
        String status,
        String output,
        @JsonProperty("error_kind") String errorKind,
        String error,
        boolean terminal,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("finished_at") String finishedAt
    ) {
        static OutcomeResponse from(StepOutcome outcome) {
            return new OutcomeResponse(
                    outcome.stepId().toString(),
                    outcome.attemptNumber(),
                    outcome.status().name(),
                    outcome.output(),
                    outcome.errorKind() != null ? outcome.errorKind().name() : null,
                    outcome.error(),
                    outcome.terminal(),
                    String.valueOf(outcome.startedAt()),
                    String.valueOf(outcome.finishedAt()));
        }
    }

    public record InterruptionResponse(
        String type,
        String reason,
        @JsonProperty("requested_at") String requestedAt
    ) {
        static InterruptionResponse from(Interruption interruption) {
            return new InterruptionResponse(interruption.type().name(), interruption.reason(),
                    String.valueOf(interruption.requestedAt()));
        }
    }
}
