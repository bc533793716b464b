package com.ozone.core.assessment;

import com.ozone.core.model.Task;

/**
 * Pluggable scorer for one quality dimension of a completed task.
 * <p>
 * Every {@code Assessor} bean is picked up by the {@link AssessmentAggregator}.
 */
public interface Assessor {

    /** Dimension name this assessor scores, unique across assessors. */
    String dimension();

    /**
     * @return the score for {@link #dimension()}, in [0.0, 1.0], with free-text findings
     * @throws AssessmentException when the task cannot be scored on this dimension
     */
    DimensionAssessment assess(Task task) throws AssessmentException;
}
