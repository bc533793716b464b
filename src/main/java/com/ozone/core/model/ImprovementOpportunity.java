package com.ozone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A dimension that scored below the improvement threshold, with the assessor's findings.
 */
public record ImprovementOpportunity(
    String dimension,
    double score,
    List<String> findings
) implements Serializable {

    public ImprovementOpportunity {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
