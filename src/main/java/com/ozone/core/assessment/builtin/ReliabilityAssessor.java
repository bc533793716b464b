package com.ozone.core.assessment.builtin;

import com.ozone.core.assessment.AssessmentException;
import com.ozone.core.assessment.Assessor;
import com.ozone.core.assessment.DimensionAssessment;
import com.ozone.core.model.StepId;
import com.ozone.core.model.StepOutcome;
import com.ozone.core.model.Task;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores the share of executed steps whose first attempt succeeded.
 */
@Component
public class ReliabilityAssessor implements Assessor {

    public static final String DIMENSION = "reliability";

    @Override
    public String dimension() {
        return DIMENSION;
    }

    @Override
    public DimensionAssessment assess(Task task) {
        Map<StepId, List<StepOutcome>> attemptsByStep = new LinkedHashMap<>();
        for (StepOutcome outcome : task.history()) {
            if (!outcome.isSkipped()) {
                attemptsByStep.computeIfAbsent(outcome.stepId(), id -> new ArrayList<>()).add(outcome);
            }
        }
        if (attemptsByStep.isEmpty()) {
            throw new AssessmentException("Task " + task.id() + " executed no steps");
        }

        int firstTry = 0;
        var findings = new ArrayList<String>();
        for (var entry : attemptsByStep.entrySet()) {
            List<StepOutcome> attempts = entry.getValue();
            if (attempts.get(0).isSuccess()) {
                firstTry++;
            } else {
                findings.add("Step " + entry.getKey() + " needed " + attempts.size() + " attempt(s)");
            }
        }
        return new DimensionAssessment(DIMENSION, (double) firstTry / attemptsByStep.size(), findings);
    }
}
