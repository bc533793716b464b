package com.ozone.integration;

import com.ozone.core.assessment.AssessmentAggregator;
import com.ozone.core.assessment.AssessmentProperties;
import com.ozone.core.assessment.AssessmentService;
import com.ozone.core.assessment.builtin.CoverageAssessor;
import com.ozone.core.assessment.builtin.ReliabilityAssessor;
import com.ozone.core.model.AssessmentReport;
import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.ProgressView;
import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;
import com.ozone.core.progress.ProgressReporter;
import com.ozone.core.support.OrchestrationHarness;
import com.ozone.core.support.ScriptedProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end lifecycle of a task through real components: planning, execution with a
 * retried step, pause and resume, assessment and eviction.
 */
@Tag("integration")
@DisplayName("Task lifecycle end-to-end")
class TaskLifecycleIntegrationTest {

    private static final String OBJECTIVE = """
            # four sequential steps
            work: a
            work: b
            work: c
            work: d
            """;

    private ScriptedProvider provider;
    private OrchestrationHarness harness;
    private ProgressReporter progress;
    private AssessmentService assessments;

    @BeforeEach
    void setUp() {
        provider = new ScriptedProvider("work");
        harness = OrchestrationHarness.lines("work", provider);
        progress = new ProgressReporter(harness.registry);
        var properties = new AssessmentProperties();
        var aggregator = new AssessmentAggregator(
                List.of(new ReliabilityAssessor(), new CoverageAssessor()), properties);
        assessments = new AssessmentService(harness.registry, aggregator, properties, harness.eventBus,
                harness.metrics);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    @DisplayName("submit, retry, pause, resume, complete, assess and evict")
    void fullLifecycle() throws Exception {
        provider.failTimes("b", 1).hold("c");

        UUID id = harness.orchestrator.submitTask(OBJECTIVE);
        assertTrue(provider.awaitInvoked("c", 5, TimeUnit.SECONDS));

        harness.interruptions.pause(id, "checkpoint review");
        provider.release("c");

        Task paused = harness.awaitSettled(id);
        assertEquals(TaskState.PAUSED, paused.state());
        assertEquals(3, paused.cursor());

        ProgressView view = progress.report(id);
        assertEquals(75.0, view.percentComplete());
        assertNotNull(view.estimatedRemaining());

        var early = assertThrows(OrchestrationException.class, () -> assessments.getAssessment(id));
        assertEquals(ErrorKind.INVALID_TRANSITION, early.kind());

        harness.interruptions.resume(id, null);
        Task done = harness.awaitSettled(id);

        assertEquals(TaskState.COMPLETED, done.state());
        assertEquals(4, done.cursor());
        assertEquals(5, done.history().size(), "b fails once, everything else succeeds first time");
        assertEquals(List.of("a", "b", "b", "c", "d"), provider.invocations());
        assertEquals(List.of("PAUSE", "RESUME"),
                done.interruptions().stream().map(i -> i.type().name()).toList());

        AssessmentReport report = assessments.getAssessment(id);
        assertEquals(0.75, report.dimensionScores().get("reliability"), 1e-9);
        assertEquals(1.0, report.dimensionScores().get("coverage"), 1e-9);
        assertEquals(0.875, report.overallScore(), 1e-9);
        assertEquals(List.of("coverage"), report.strengths());
        assertTrue(report.improvementOpportunities().isEmpty());
        assertSame(report, assessments.getAssessment(id));

        List<String> events = harness.eventTypes(id);
        assertEquals("task.submitted", events.get(0));
        assertTrue(events.indexOf("task.paused") < events.indexOf("task.resumed"));
        assertEquals("task.completed", events.get(events.size() - 1));

        harness.orchestrator.evict(id);
        var gone = assertThrows(OrchestrationException.class, () -> harness.orchestrator.getTask(id));
        assertEquals(ErrorKind.NOT_FOUND, gone.kind());
    }

    @Test
    @DisplayName("cancelled task keeps its history and cannot be assessed")
    void cancelledTask() throws Exception {
        provider.hold("b");

        UUID id = harness.orchestrator.submitTask(OBJECTIVE);
        assertTrue(provider.awaitInvoked("b", 5, TimeUnit.SECONDS));

        harness.interruptions.cancel(id, "no longer needed");
        provider.release("b");
        Task cancelled = harness.awaitSettled(id);

        assertEquals(TaskState.CANCELLED, cancelled.state());
        assertFalse(provider.invocations().contains("c"));
        assertFalse(cancelled.history().isEmpty());

        var ex = assertThrows(OrchestrationException.class, () -> assessments.getAssessment(id));
        assertEquals(ErrorKind.INVALID_TRANSITION, ex.kind());
    }
}
