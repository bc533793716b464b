package com.ozone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ozone.core.model.AssessmentReport;
import com.ozone.core.model.ImprovementOpportunity;

import java.util.List;
import java.util.Map;

/**
 * JSON response for GET /api/v1/tasks/{id}/assessment.
 */
public record AssessmentResponse(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("dimension_scores") Map<String, Double> dimensionScores,
    @JsonProperty("overall_score") double overallScore,
    List<String> strengths,
    @JsonProperty("improvement_opportunities") List<ImprovementOpportunity> improvementOpportunities,
    List<String> warnings
) {

    public static AssessmentResponse from(AssessmentReport report) {
        return new AssessmentResponse(
                report.subjectTaskId().toString(),
                report.dimensionScores(),
                report.overallScore(),
                report.strengths(),
                report.improvementOpportunities(),
                report.warnings());
    }
}
