package com.ozone.core.assessment;

import com.ozone.core.events.EventBus;
import com.ozone.core.events.OzoneEvent;
import com.ozone.core.events.OzoneEventType;
import com.ozone.core.metrics.OzoneMetrics;
import com.ozone.core.model.AssessmentReport;
import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.Plan;
import com.ozone.core.model.Step;
import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;
import com.ozone.core.registry.InMemoryTaskRegistry;
import com.ozone.core.support.OrchestrationHarness;
import com.ozone.core.support.ScriptedProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AssessmentServiceTest {

    private InMemoryTaskRegistry registry;
    private AssessmentAggregator aggregator;
    private AssessmentProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private EventBus eventBus;
    private AssessmentService service;

    @BeforeEach
    void setUp() {
        registry = new InMemoryTaskRegistry(10, Clock.systemUTC());
        aggregator = mock(AssessmentAggregator.class);
        properties = new AssessmentProperties();
        meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        service = new AssessmentService(registry, aggregator, properties, eventBus, new OzoneMetrics(meterRegistry));
    }

    private UUID completedTask() {
        UUID id = registry.createTask("done");
        registry.update(id, t -> t.withPlan(Plan.sequential(List.of(Step.of(0, "step-1", "echo", "x"))))
                .transitionTo(TaskState.RUNNING)
                .withCursor(1)
                .transitionTo(TaskState.COMPLETED));
        return id;
    }

    private static AssessmentReport report(UUID id, double overall) {
        return new AssessmentReport(id, Map.of("quality", overall), overall, List.of(), List.of(), List.of());
    }

    @Test
    void assessesCompletedTask() {
        UUID id = completedTask();
        when(aggregator.aggregate(any(Task.class))).thenReturn(report(id, 0.8));

        AssessmentReport result = service.getAssessment(id);

        assertEquals(0.8, result.overallScore());
        var summary = meterRegistry.find("ozone.assessment.overall_score").summary();
        assertNotNull(summary);
        assertEquals(1, summary.count());
    }

    @Test
    void cachedReportIsReused() {
        UUID id = completedTask();
        when(aggregator.aggregate(any(Task.class))).thenReturn(report(id, 0.8), report(id, 0.1));

        AssessmentReport first = service.getAssessment(id);
        AssessmentReport second = service.getAssessment(id);

        assertSame(first, second);
        verify(aggregator, times(1)).aggregate(any(Task.class));
    }

    @Test
    void forgetDropsTheCachedReport() {
        UUID id = completedTask();
        when(aggregator.aggregate(any(Task.class))).thenReturn(report(id, 0.8), report(id, 0.1));

        service.getAssessment(id);
        service.forget(id);

        assertEquals(0.1, service.getAssessment(id).overallScore());
    }

    @Test
    @DisplayName("an eviction event drops that task's cached report only")
    void evictionEventDropsCachedReport() {
        UUID evicted = completedTask();
        UUID kept = completedTask();
        when(aggregator.aggregate(any(Task.class))).thenReturn(report(evicted, 0.8));
        service.getAssessment(evicted);
        service.getAssessment(kept);
        assertEquals(2, service.cachedReportCount());

        eventBus.publish(OzoneEvent.forTask(OzoneEventType.TASK_EVICTED, evicted, Map.of(), Instant.now()));

        assertEquals(1, service.cachedReportCount());
        service.getAssessment(kept);
        verify(aggregator, times(2)).aggregate(any(Task.class));
    }

    @Test
    @DisplayName("evicting through the orchestrator releases the cached report")
    void orchestratorEvictionReleasesReport() throws Exception {
        try (var harness = OrchestrationHarness.lines("analysis", new ScriptedProvider("analysis"))) {
            var wired = new AssessmentService(harness.registry, aggregator, properties, harness.eventBus,
                    harness.metrics);
            UUID id = harness.orchestrator.submitTask("analysis: a\nanalysis: b");
            assertEquals(TaskState.COMPLETED, harness.awaitSettled(id).state());
            when(aggregator.aggregate(any(Task.class))).thenReturn(report(id, 0.9));
            wired.getAssessment(id);
            assertEquals(1, wired.cachedReportCount());

            harness.orchestrator.evict(id);

            assertEquals(0, wired.cachedReportCount());
            assertTrue(harness.eventTypes(id).contains("task.evicted"));
        }
    }

    @Test
    void cachingCanBeDisabled() {
        properties.setCacheReports(false);
        UUID id = completedTask();
        when(aggregator.aggregate(any(Task.class))).thenReturn(report(id, 0.8));

        service.getAssessment(id);
        service.getAssessment(id);

        verify(aggregator, times(2)).aggregate(any(Task.class));
    }

    @Test
    void onlyCompletedTasksAreAssessed() {
        UUID id = registry.createTask("still planning");

        var ex = assertThrows(OrchestrationException.class, () -> service.getAssessment(id));

        assertEquals(ErrorKind.INVALID_TRANSITION, ex.kind());
        verify(aggregator, times(0)).aggregate(any(Task.class));
    }

    @Test
    void unknownTaskIsNotFound() {
        var ex = assertThrows(OrchestrationException.class, () -> service.getAssessment(UUID.randomUUID()));
        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
    }

    @Test
    void aggregatorFailurePropagates() {
        UUID id = completedTask();
        when(aggregator.aggregate(any(Task.class)))
                .thenThrow(new OrchestrationException(ErrorKind.NO_ASSESSMENT_AVAILABLE, "nothing"));

        var ex = assertThrows(OrchestrationException.class, () -> service.getAssessment(id));
        assertEquals(ErrorKind.NO_ASSESSMENT_AVAILABLE, ex.kind());
    }
}
