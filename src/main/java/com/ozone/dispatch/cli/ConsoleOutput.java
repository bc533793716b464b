package com.ozone.dispatch.cli;

import com.ozone.core.events.OzoneEventType;
import com.ozone.core.model.AssessmentReport;
import com.ozone.core.model.ImprovementOpportunity;
import com.ozone.core.model.StepOutcome;
import com.ozone.core.model.Task;
import picocli.CommandLine;

import java.time.Duration;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Ozone CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) OZONE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [OZONE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stepOutcome(StepOutcome outcome) {
        String status = switch (outcome.status()) {
            case SUCCESS -> "@|fg(green) OK  |@";
            case FAILURE -> "@|fg(red) FAIL|@";
            case SKIPPED -> "@|fg(yellow) SKIP|@";
        };
        String detail = outcome.isSuccess() ? truncate(outcome.output(), 50) : outcome.error();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + outcome.stepId() + " #" + outcome.attemptNumber()
                        + " (" + formatDuration(outcome.duration().toMillis()) + ") " + detail));
    }

    public static void taskSummary(Task task) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Task " + task.id() + "|@"));
        String state = switch (task.state()) {
            case COMPLETED -> "@|fg(green),bold COMPLETED|@";
            case FAILED -> "@|fg(red),bold FAILED|@";
            case CANCELLED -> "@|fg(yellow),bold CANCELLED|@";
            default -> task.state().name();
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  State: " + state));
        System.out.println("  Steps: " + task.cursor() + "/" + task.totalSteps()
                + " (" + task.history().size() + " attempt(s), strategy " + task.strategy() + ")");
        Duration elapsed = Duration.between(task.createdAt(), task.updatedAt());
        System.out.println("  Duration: " + formatDuration(elapsed.toMillis()));
    }

    public static void assessment(AssessmentReport report) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Assessment|@ overall " + String.format("%.3f", report.overallScore())));
        for (Map.Entry<String, Double> entry : report.dimensionScores().entrySet()) {
            System.out.printf("  %-14s %.3f%n", entry.getKey(), entry.getValue());
        }
        for (String strength : report.strengths()) {
            success("Strength: " + strength);
        }
        for (ImprovementOpportunity opportunity : report.improvementOpportunities()) {
            warn("Improve: " + opportunity.dimension() + " (" + String.format("%.3f", opportunity.score()) + ")");
            for (String finding : opportunity.findings()) {
                System.out.println("      - " + finding);
            }
        }
        for (String warning : report.warnings()) {
            warn(warning);
        }
    }

    /**
     * Prints one execution event. {@code eventType} is the wire name as streamed over SSE;
     * names this CLI does not know are printed as they are.
     */
    public static void watchEvent(String eventType, String data) {
        String prefix = OzoneEventType.fromWireName(eventType)
                .map(ConsoleOutput::prefixFor)
                .orElse("@|fg(white) [" + eventType + "]|@");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    private static String prefixFor(OzoneEventType type) {
        return switch (type) {
            case TASK_SUBMITTED, TASK_RUNNING, TASK_RESUMED -> "@|fg(cyan) [TASK]|@";
            case STEP_STARTED, STEP_COMPLETED -> "@|fg(blue) [STEP]|@";
            case STEP_FAILED -> "@|fg(red) [STEP]|@";
            case TASK_PAUSED -> "@|fg(yellow) [PAUSED]|@";
            case TASK_CANCELLED -> "@|fg(yellow),bold [CANCELLED]|@";
            case TASK_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case TASK_FAILED -> "@|fg(red),bold [FAILED]|@";
            case TASK_EVICTED -> "@|fg(white) [EVICTED]|@";
        };
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String line = s.replace('\n', ' ');
        return line.length() <= max ? line : line.substring(0, max - 3) + "...";
    }
}
