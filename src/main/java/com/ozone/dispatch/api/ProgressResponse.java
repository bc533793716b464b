package com.ozone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ozone.core.model.ProgressView;
import com.ozone.core.model.StepOutcome;

/**
 * JSON response for GET /api/v1/tasks/{id}/progress.
 */
public record ProgressResponse(
    @JsonProperty("task_id") String taskId,
    String state,
    int cursor,
    @JsonProperty("total_steps") int totalSteps,
    @JsonProperty("percent_complete") double percentComplete,
    @JsonProperty("last_outcome") TaskResponse.OutcomeResponse lastOutcome,
    @JsonProperty("pending_interruption") String pendingInterruption,
    @JsonProperty("estimated_remaining_ms") Long estimatedRemainingMs,
    @JsonProperty("updated_at") String updatedAt
) {

    public static ProgressResponse from(ProgressView view) {
        StepOutcome last = view.lastOutcome();
        return new ProgressResponse(
                view.taskId().toString(),
                view.state().name(),
                view.cursor(),
                view.totalSteps(),
                view.percentComplete(),
                last != null ? TaskResponse.OutcomeResponse.from(last) : null,
                view.pendingInterruption() != null ? view.pendingInterruption().name() : null,
                view.estimatedRemaining() != null ? view.estimatedRemaining().toMillis() : null,
                String.valueOf(view.updatedAt()));
    }
}
