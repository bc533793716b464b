package com.ozone.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregated multi-dimensional assessment of a completed task.
 *
 * @param subjectTaskId            the task evaluated
 * @param dimensionScores          score per dimension, each in [0.0, 1.0], ordered by dimension name
 * @param overallScore             weighted mean of the produced dimension scores
 * @param strengths                dimensions at or above the strength threshold, highest first
 * @param improvementOpportunities dimensions below the improvement threshold, lowest first
 * @param warnings                 assessors that failed or produced unusable output
 */
public record AssessmentReport(
    UUID subjectTaskId,
    Map<String, Double> dimensionScores,
    double overallScore,
    List<String> strengths,
    List<ImprovementOpportunity> improvementOpportunities,
    List<String> warnings
) implements Serializable {

    public AssessmentReport {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        improvementOpportunities = improvementOpportunities == null ? List.of() : List.copyOf(improvementOpportunities);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
