package com.ozone.core.assessment;

import com.ozone.core.model.AssessmentReport;
import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.ImprovementOpportunity;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Combines the scores of all registered {@link Assessor}s into an {@link AssessmentReport}.
 * <p>
 * Assessors run independently: one that throws, returns nothing, repeats a dimension
 * or scores outside [0.0, 1.0] is left out of the report and noted as a warning.
 * The overall score is the weighted mean of the dimensions actually produced.
 */
@Component
public class AssessmentAggregator {

    private static final Logger log = LoggerFactory.getLogger(AssessmentAggregator.class);

    private static final Comparator<DimensionAssessment> BY_SCORE =
            Comparator.comparingDouble(DimensionAssessment::score).thenComparing(DimensionAssessment::dimension);

    private final List<Assessor> assessors;
    private final AssessmentProperties properties;

    public AssessmentAggregator(List<Assessor> assessors, AssessmentProperties properties) {
        this.assessors = List.copyOf(assessors);
        this.properties = properties;
    }

    public List<Assessor> getAssessors() {
        return assessors;
    }

    /**
     * Runs every assessor over {@code task} and aggregates the results.
     *
     * @throws OrchestrationException NO_ASSESSMENT_AVAILABLE when no assessor produced a usable score
     */
    public AssessmentReport aggregate(Task task) {
        var produced = new LinkedHashMap<String, DimensionAssessment>();
        var warnings = new ArrayList<String>();

        for (Assessor assessor : assessors) {
            String name = assessor.dimension();
            DimensionAssessment result;
            try {
                result = assessor.assess(task);
            } catch (RuntimeException e) {
                log.warn("Assessor '{}' failed for task {}: {}", name, task.id(), e.getMessage());
                warnings.add("Assessor '" + name + "' failed: " + e.getMessage());
                continue;
            }
            if (result == null) {
                warnings.add("Assessor '" + name + "' produced no result");
                continue;
            }
            String dimension = result.dimension() != null && !result.dimension().isBlank() ? result.dimension() : name;
            double score = result.score();
            if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
                log.warn("Assessor '{}' scored {} outside [0.0, 1.0] for task {}", name, score, task.id());
                warnings.add("Assessor '" + name + "' scored " + score + " outside [0.0, 1.0]");
                continue;
            }
            if (produced.containsKey(dimension)) {
                warnings.add("Assessor '" + name + "' repeated dimension '" + dimension + "'");
                continue;
            }
            produced.put(dimension, new DimensionAssessment(dimension, score, result.findings()));
        }

        return combine(task.id(), List.copyOf(produced.values()), warnings);
    }

    /**
     * Pure aggregation of already-produced dimension scores.
     *
     * @throws OrchestrationException NO_ASSESSMENT_AVAILABLE when {@code produced} is empty
     */
    public AssessmentReport combine(UUID taskId, List<DimensionAssessment> produced, List<String> warnings) {
        if (produced.isEmpty()) {
            throw new OrchestrationException(ErrorKind.NO_ASSESSMENT_AVAILABLE,
                    "No assessor produced a score for task " + taskId
                            + (warnings.isEmpty() ? "" : ": " + String.join("; ", warnings)));
        }

        var reportWarnings = new ArrayList<>(warnings);
        Map<String, Double> scores = new TreeMap<>();
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (DimensionAssessment assessment : produced) {
            double weight = properties.weightFor(assessment.dimension());
            if (weight < 0.0) {
                reportWarnings.add("Negative weight for '" + assessment.dimension() + "' ignored");
                weight = 0.0;
            }
            scores.put(assessment.dimension(), assessment.score());
            weightedSum += weight * assessment.score();
            totalWeight += weight;
        }

        double overall;
        if (totalWeight > 0.0) {
            overall = weightedSum / totalWeight;
        } else {
            reportWarnings.add("All produced dimensions have zero weight");
            overall = 0.0;
        }

        List<String> strengths = produced.stream()
                .filter(a -> a.score() >= properties.getStrengthThreshold())
                .sorted(Comparator.comparingDouble(DimensionAssessment::score).reversed()
                        .thenComparing(DimensionAssessment::dimension))
                .map(DimensionAssessment::dimension)
                .toList();

        List<ImprovementOpportunity> improvements = produced.stream()
                .filter(a -> a.score() < properties.getImprovementThreshold())
                .sorted(BY_SCORE)
                .map(a -> new ImprovementOpportunity(a.dimension(), a.score(), a.findings()))
                .toList();

        return new AssessmentReport(taskId, Collections.unmodifiableMap(scores), overall,
                strengths, improvements, reportWarnings);
    }
}
