package com.ozone.core.health;

import com.ozone.core.assessment.AssessmentAggregator;
import com.ozone.core.assessment.Assessor;
import com.ozone.core.engine.Planner;
import com.ozone.core.executor.CapabilityRegistry;
import com.ozone.core.registry.TaskRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
public class HealthCheckService {

    /** Registry fill ratio at which capacity is reported DEGRADED. */
    static final double REGISTRY_DEGRADED_RATIO = 0.9;

    private final Planner planner;
    private final CapabilityRegistry capabilityRegistry;
    private final AssessmentAggregator assessmentAggregator;
    private final TaskRegistry taskRegistry;

    public HealthCheckService(
            @Autowired(required = false) Planner planner,
            @Autowired(required = false) CapabilityRegistry capabilityRegistry,
            @Autowired(required = false) AssessmentAggregator assessmentAggregator,
            TaskRegistry taskRegistry) {
        this.planner = planner;
        this.capabilityRegistry = capabilityRegistry;
        this.assessmentAggregator = assessmentAggregator;
        this.taskRegistry = taskRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPlanner());
        results.add(checkProviders());
        results.add(checkAssessors());
        results.add(checkRegistry());
        return results;
    }

    private HealthStatus checkPlanner() {
        if (planner == null) {
            return new HealthStatus("planner", HealthStatus.Status.DOWN,
                    "No Planner configured", Map.of());
        }
        return new HealthStatus("planner", HealthStatus.Status.UP,
                "Planner available (" + planner.getClass().getSimpleName() + ")", Map.of());
    }

    private HealthStatus checkProviders() {
        if (capabilityRegistry == null || capabilityRegistry.capabilities().isEmpty()) {
            return new HealthStatus("providers", HealthStatus.Status.DOWN,
                    "No capability providers registered", Map.of());
        }
        String capabilities = String.join(",", new TreeSet<>(capabilityRegistry.capabilities()));
        return new HealthStatus("providers", HealthStatus.Status.UP,
                capabilityRegistry.capabilities().size() + " capability provider(s) registered",
                Map.of("capabilities", capabilities));
    }

    private HealthStatus checkAssessors() {
        if (assessmentAggregator == null || assessmentAggregator.getAssessors().isEmpty()) {
            return new HealthStatus("assessors", HealthStatus.Status.DEGRADED,
                    "No assessors registered, assessments unavailable", Map.of());
        }
        String dimensions = assessmentAggregator.getAssessors().stream()
                .map(Assessor::dimension)
                .sorted()
                .collect(Collectors.joining(","));
        return new HealthStatus("assessors", HealthStatus.Status.UP,
                assessmentAggregator.getAssessors().size() + " assessor(s) registered",
                Map.of("dimensions", dimensions));
    }

    private HealthStatus checkRegistry() {
        int size = taskRegistry.size();
        int capacity = taskRegistry.capacity();
        var metadata = Map.of("size", String.valueOf(size), "capacity", String.valueOf(capacity));
        if (size >= capacity) {
            return new HealthStatus("registry", HealthStatus.Status.DOWN,
                    "Registry full, new tasks are rejected", metadata);
        }
        if (size >= capacity * REGISTRY_DEGRADED_RATIO) {
            return new HealthStatus("registry", HealthStatus.Status.DEGRADED,
                    "Registry above " + (int) (REGISTRY_DEGRADED_RATIO * 100) + "% of capacity", metadata);
        }
        return new HealthStatus("registry", HealthStatus.Status.UP,
                "Registry holds " + size + " of " + capacity + " task(s)", metadata);
    }
}
