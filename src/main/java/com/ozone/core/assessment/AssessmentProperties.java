package com.ozone.core.assessment;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "ozone.assessment")
public class AssessmentProperties {

    /** Weight used for any dimension without an explicit entry in {@link #weights}. */
    public static final double DEFAULT_WEIGHT = 1.0;

    private double strengthThreshold = 0.9;
    private double improvementThreshold = 0.7;
    private Map<String, Double> weights = new HashMap<>();
    private boolean cacheReports = true;

    public double weightFor(String dimension) {
        Double weight = weights.get(dimension);
        return weight != null ? weight : DEFAULT_WEIGHT;
    }

    public double getStrengthThreshold() { return strengthThreshold; }
    public void setStrengthThreshold(double strengthThreshold) { this.strengthThreshold = strengthThreshold; }
    public double getImprovementThreshold() { return improvementThreshold; }
    public void setImprovementThreshold(double improvementThreshold) { this.improvementThreshold = improvementThreshold; }
    public Map<String, Double> getWeights() { return weights; }
    public void setWeights(Map<String, Double> weights) { this.weights = weights; }
    public boolean isCacheReports() { return cacheReports; }
    public void setCacheReports(boolean cacheReports) { this.cacheReports = cacheReports; }
}
