package com.ozone.core.assessment.builtin;

import com.ozone.core.assessment.AssessmentException;
import com.ozone.core.assessment.Assessor;
import com.ozone.core.assessment.DimensionAssessment;
import com.ozone.core.model.Step;
import com.ozone.core.model.StepId;
import com.ozone.core.model.StepOutcome;
import com.ozone.core.model.Task;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;

/**
 * Scores the share of planned steps that produced a successful result rather than
 * being skipped.
 */
@Component
public class CoverageAssessor implements Assessor {

    public static final String DIMENSION = "coverage";

    @Override
    public String dimension() {
        return DIMENSION;
    }

    @Override
    public DimensionAssessment assess(Task task) {
        if (task.plan().isEmpty()) {
            throw new AssessmentException("Task " + task.id() + " has an empty plan");
        }
        Set<StepId> succeeded = new HashSet<>();
        for (StepOutcome outcome : task.history()) {
            if (outcome.isSuccess()) {
                succeeded.add(outcome.stepId());
            }
        }

        var findings = new ArrayList<String>();
        for (Step step : task.plan()) {
            if (!succeeded.contains(step.id())) {
                findings.add("Step " + step.id() + " produced no result");
            }
        }
        double score = (double) (task.plan().size() - findings.size()) / task.plan().size();
        return new DimensionAssessment(DIMENSION, score, findings);
    }
}
