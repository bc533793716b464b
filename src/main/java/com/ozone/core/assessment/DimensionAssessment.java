package com.ozone.core.assessment;

import java.util.List;

/**
 * One assessor's output.
 *
 * @param dimension dimension name
 * @param score     score in [0.0, 1.0]
 * @param findings  free-text observations backing the score
 */
public record DimensionAssessment(String dimension, double score, List<String> findings) {

    public DimensionAssessment {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static DimensionAssessment of(String dimension, double score, String... findings) {
        return new DimensionAssessment(dimension, score, List.of(findings));
    }
}
