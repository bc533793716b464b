package com.ozone.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ozone.core.assessment.AssessmentService;
import com.ozone.core.engine.Orchestrator;
import com.ozone.core.events.EventBus;
import com.ozone.core.events.OzoneEvent;
import com.ozone.core.events.OzoneEventType;
import com.ozone.core.health.HealthCheckService;
import com.ozone.core.health.HealthStatus;
import com.ozone.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Ozone CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private static final UUID TASK_ID = UUID.fromString("3d2f7a10-5b6c-4e8d-9f01-a2b3c4d5e6f7");
    private static final Instant T0 = Instant.parse("2026-05-04T09:00:00Z");

    private record CliResult(int exitCode, String output) {}

    private final Orchestrator orchestrator = mock(Orchestrator.class);
    private final AssessmentService assessmentService = mock(AssessmentService.class);
    private final EventBus eventBus = new EventBus();
    private List<HealthStatus> healthChecks = List.of();

    private static Task completedTask() {
        var steps = List.of(Step.of(0, "step-1", "echo", "hello"), Step.of(1, "step-2", "echo", "world"));
        Task task = Task.create(TASK_ID, "echo: hello\necho: world", T0)
                .withPlan(Plan.sequential(steps))
                .transitionTo(TaskState.RUNNING)
                .appendOutcome(StepOutcome.success(steps.get(0).id(), 1, "hello", T0, T0.plusMillis(12)))
                .appendOutcome(StepOutcome.success(steps.get(1).id(), 1, "world", T0, T0.plusMillis(8)))
                .withCursor(2)
                .transitionTo(TaskState.COMPLETED);
        return task.touchedAt(T0.plusMillis(1500));
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(orchestrator, assessmentService, eventBus);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(new ObjectMapper());
                }
                if (cls == HealthCommand.class) {
                    HealthCheckService mockHealth = mock(HealthCheckService.class);
                    when(mockHealth.checkAll()).thenReturn(healthChecks);
                    return (K) new HealthCommand(mockHealth);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new OzoneCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "status", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("Task orchestration and assessment engine"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Ozone 0.1.0"));
        }

        @Test
        @DisplayName("run --help shows the objective options")
        void runHelp() {
            CliResult result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--file"));
            assertTrue(result.output().contains("--timeout"));
        }

        @Test
        @DisplayName("status --help shows --watch and --port")
        void statusHelp() {
            CliResult result = execute("status", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--watch"));
            assertTrue(result.output().contains("--port"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("OZONE v0.1.0"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("unknown subcommand fails with non-zero exit code")
        void unknownSubcommand() {
            CliResult result = execute("launch");
            assertNotEquals(0, result.exitCode());
        }
    }

    // =====================================================================
    //  run
    // =====================================================================

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("prints step outcomes, summary and assessment of a completed task")
        void runCompletedTask() {
            Task task = completedTask();
            when(orchestrator.submitTask(anyString())).thenReturn(TASK_ID);
            when(orchestrator.completion(TASK_ID)).thenReturn(CompletableFuture.completedFuture(task));
            when(assessmentService.getAssessment(TASK_ID)).thenReturn(new AssessmentReport(
                    TASK_ID, Map.of("coverage", 1.0, "reliability", 0.5), 0.75,
                    List.of("coverage"),
                    List.of(new ImprovementOpportunity("reliability", 0.5, List.of("Step 1:step-2 needed 2 attempt(s)"))),
                    List.of()));

            CliResult result = execute("run", "echo: hello\necho: world");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("Task " + TASK_ID + " running"));
            assertTrue(output.contains("0:step-1"));
            assertTrue(output.contains("COMPLETED"));
            assertTrue(output.contains("Steps: 2/2"));
            assertTrue(output.contains("Assessment"));
            assertTrue(output.contains("Strength: coverage"));
            assertTrue(output.contains("Improve: reliability"));
            assertTrue(output.contains("needed 2 attempt(s)"));
        }

        @Test
        @DisplayName("reads the objective from --file")
        void runFromFile(@TempDir Path dir) throws Exception {
            Path objective = dir.resolve("objective.txt");
            Files.writeString(objective, "echo: from file\n");
            when(orchestrator.submitTask("echo: from file\n")).thenReturn(TASK_ID);
            when(orchestrator.completion(TASK_ID)).thenReturn(CompletableFuture.completedFuture(completedTask()));
            when(assessmentService.getAssessment(TASK_ID))
                    .thenThrow(new OrchestrationException(ErrorKind.NO_ASSESSMENT_AVAILABLE, "No assessor produced a score"));

            CliResult result = execute("run", "--file", objective.toString());

            assertEquals(0, result.exitCode());
            verify(orchestrator).submitTask("echo: from file\n");
            assertTrue(result.output().contains("No assessment: No assessor produced a score"));
        }

        @Test
        @DisplayName("missing objective is reported without submitting")
        void missingObjective() {
            CliResult result = execute("run");

            assertTrue(result.output().contains("An objective or --file is required"));
            verify(orchestrator, never()).submitTask(any());
        }

        @Test
        @DisplayName("submission errors are printed with their kind")
        void submitRejected() {
            when(orchestrator.submitTask(anyString()))
                    .thenThrow(new OrchestrationException(ErrorKind.UNKNOWN_CAPABILITY,
                            "No provider registered for capability 'translate'"));

            CliResult result = execute("run", "translate: hola");

            assertTrue(result.output().contains("UNKNOWN_CAPABILITY"));
            assertTrue(result.output().contains("translate"));
        }

        @Test
        @DisplayName("failed tasks are summarised without an assessment")
        void failedTask() {
            var step = Step.of(0, "step-1", "echo", "x");
            Task failed = Task.create(TASK_ID, "echo: x", T0)
                    .withPlan(Plan.sequential(List.of(step)))
                    .transitionTo(TaskState.RUNNING)
                    .appendOutcome(StepOutcome.failure(step.id(), 1, ErrorKind.PROVIDER_ERROR, "boom", true, T0, T0))
                    .transitionTo(TaskState.FAILED);
            when(orchestrator.submitTask(anyString())).thenReturn(TASK_ID);
            when(orchestrator.completion(TASK_ID)).thenReturn(CompletableFuture.completedFuture(failed));

            CliResult result = execute("run", "echo: x");

            assertTrue(result.output().contains("FAILED"));
            assertTrue(result.output().contains("boom"));
            verify(assessmentService, never()).getAssessment(any());
        }

        @Test
        @DisplayName("step events published while the task runs are echoed")
        void echoesStepEvents() {
            when(orchestrator.submitTask(anyString())).thenAnswer(inv -> {
                eventBus.publish(OzoneEvent.forStep(OzoneEventType.STEP_COMPLETED, TASK_ID, "0:step-1",
                        Map.of("attempt", 1), Instant.now()));
                return TASK_ID;
            });
            when(orchestrator.completion(TASK_ID)).thenReturn(CompletableFuture.completedFuture(completedTask()));
            when(assessmentService.getAssessment(TASK_ID))
                    .thenThrow(new OrchestrationException(ErrorKind.NO_ASSESSMENT_AVAILABLE, "none"));

            CliResult result = execute("run", "echo: hello");

            assertTrue(result.output().contains("[STEP] 0:step-1"));
        }
    }

    // =====================================================================
    //  health / status
    // =====================================================================

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("all UP reports operational")
        void allUp() {
            healthChecks = List.of(
                    new HealthStatus("planner", HealthStatus.Status.UP, "Planner available (LinePlanner)", Map.of()),
                    new HealthStatus("providers", HealthStatus.Status.UP, "1 capability provider(s) registered", Map.of()));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("planner: Planner available (LinePlanner)"));
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("a DOWN component is reported")
        void componentDown() {
            healthChecks = List.of(
                    new HealthStatus("providers", HealthStatus.Status.DOWN, "No capability providers registered", Map.of()));

            CliResult result = execute("health");

            assertTrue(result.output().contains("No capability providers registered"));
            assertTrue(result.output().contains("degraded or down"));
        }
    }

    @Test
    @DisplayName("status against a port with no server reports it cannot connect")
    void statusUnreachable() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        CliResult result = execute("status", TASK_ID.toString(), "--port", String.valueOf(port));

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("Cannot connect to Ozone server at localhost:" + port));
    }
}
