package com.ozone.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task orchestration.
 */
@Service
public class OzoneMetrics {

    private final MeterRegistry registry;

    public OzoneMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("ozone.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepAttempt(String capability, String result, Duration elapsed) {
        Timer.builder("ozone.step.attempt.duration")
                .tag("capability", capability)
                .tag("result", result)
                .register(registry)
                .record(elapsed);
    }

    public void incrementRetries(String capability) {
        Counter.builder("ozone.step.retries")
                .description("Step attempts scheduled after a failed attempt")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    public void recordTaskResult(String state) {
        Counter.builder("ozone.tasks.total")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordInterruption(String type) {
        Counter.builder("ozone.interruptions.total")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    /**
     * Records the overall score of a produced assessment report.
     *
     * @param overallScore weighted score in [0.0, 1.0]
     */
    public void recordAssessmentScore(double overallScore) {
        DistributionSummary.builder("ozone.assessment.overall_score")
                .description("Overall weighted assessment score per task")
                .register(registry)
                .record(overallScore);
    }

    public void recordRankSize(int stepCount, String strategy) {
        DistributionSummary.builder("ozone.rank.step_count")
                .description("Number of steps dispatched per rank")
                .tag("strategy", strategy)
                .register(registry)
                .record(stepCount);
    }
}
