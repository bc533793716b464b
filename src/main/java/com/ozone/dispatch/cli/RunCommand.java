package com.ozone.dispatch.cli;

import com.ozone.core.assessment.AssessmentService;
import com.ozone.core.engine.Orchestrator;
import com.ozone.core.events.EventBus;
import com.ozone.core.events.OzoneEventType;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.StepOutcome;
import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: ozone run "&lt;objective&gt;"
 * <p>
 * Runs a task in-process: plans the objective, prints step events as they arrive,
 * then the final state and, for completed tasks, the assessment report.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task and assess it")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1",
            description = "Objective, one 'capability: input' step per line")
    private String objective;

    @Option(names = {"--file", "-f"}, description = "Read the objective from a file")
    private Path file;

    @Option(names = {"--timeout", "-t"}, description = "Seconds to wait for the task (default: ${DEFAULT-VALUE})",
            defaultValue = "600")
    private long timeoutSeconds;

    private final Orchestrator orchestrator;
    private final AssessmentService assessmentService;
    private final EventBus eventBus;

    public RunCommand(Orchestrator orchestrator, AssessmentService assessmentService, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.assessmentService = assessmentService;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        String text;
        try {
            text = resolveObjective();
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read objective file " + file + ": " + e.getMessage());
            return;
        }
        if (text == null || text.isBlank()) {
            ConsoleOutput.error("An objective or --file is required");
            return;
        }

        // Step outcomes of the first rank may be published before submitTask returns the id.
        EventBus.Subscription subscription = eventBus.subscribe(
                EnumSet.of(OzoneEventType.STEP_COMPLETED, OzoneEventType.STEP_FAILED),
                event -> ConsoleOutput.watchEvent(event.eventType(), event.stepId() + " " + event.payload()));
        try {
            UUID taskId;
            try {
                taskId = orchestrator.submitTask(text);
            } catch (OrchestrationException e) {
                ConsoleOutput.error(e.kind() + ": " + e.getMessage());
                return;
            }
            ConsoleOutput.info("Task " + taskId + " running");

            Task task = awaitSettled(taskId);
            if (task == null) {
                return;
            }

            System.out.println();
            for (StepOutcome outcome : task.history()) {
                ConsoleOutput.stepOutcome(outcome);
            }
            ConsoleOutput.taskSummary(task);

            if (task.state() == TaskState.COMPLETED) {
                try {
                    ConsoleOutput.assessment(assessmentService.getAssessment(taskId));
                } catch (OrchestrationException e) {
                    ConsoleOutput.warn("No assessment: " + e.getMessage());
                }
            }
        } finally {
            subscription.unsubscribe();
        }
    }

    private String resolveObjective() throws IOException {
        if (file != null) {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        return objective;
    }

    private Task awaitSettled(UUID taskId) {
        try {
            return orchestrator.completion(taskId).get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            ConsoleOutput.error("Task " + taskId + " did not finish within " + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (ExecutionException e) {
            ConsoleOutput.error("Task " + taskId + " failed: " + e.getCause().getMessage());
        }
        return null;
    }
}
