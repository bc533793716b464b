package com.ozone.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * CLI command: ozone status &lt;task-id&gt;
 * <p>
 * Queries a running Ozone server for a task's progress, or follows its event
 * stream with {@code --watch}.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check task progress on a running server")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final ObjectMapper objectMapper;

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (watch) {
            runWatchMode();
            return;
        }

        HttpClient client = newClient();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/progress"))
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                ConsoleOutput.error("Task not found: " + taskId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode() + ": " + response.body());
                return;
            }
            printProgress(objectMapper.readTree(response.body()));
        } catch (ConnectException e) {
            reportUnreachable();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Status query failed: " + e.getMessage());
        }
    }

    void printProgress(JsonNode progress) {
        System.out.println();
        System.out.println("TASK " + progress.path("task_id").asText(taskId));

        String state = progress.path("state").asText("UNKNOWN");
        switch (state) {
            case "COMPLETED" -> ConsoleOutput.success("State: " + state);
            case "FAILED", "CANCELLED" -> ConsoleOutput.error("State: " + state);
            default -> ConsoleOutput.info("State: " + state);
        }

        System.out.printf("  Progress: %d/%d steps (%.1f%%)%n",
                progress.path("cursor").asInt(),
                progress.path("total_steps").asInt(),
                progress.path("percent_complete").asDouble());

        JsonNode pending = progress.path("pending_interruption");
        if (!pending.isMissingNode() && !pending.isNull()) {
            ConsoleOutput.warn("Pending: " + pending.asText());
        }
        JsonNode eta = progress.path("estimated_remaining_ms");
        if (!eta.isMissingNode() && !eta.isNull()) {
            System.out.println("  Remaining: ~" + ConsoleOutput.formatDuration(eta.asLong()));
        }
        JsonNode last = progress.path("last_outcome");
        if (!last.isMissingNode() && !last.isNull()) {
            System.out.printf("  Last step: %s attempt %d %s%n",
                    last.path("step_id").asText(), last.path("attempt").asInt(), last.path("status").asText());
        }
    }

    private void runWatchMode() {
        ConsoleOutput.info("Watching task " + taskId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/events"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        try {
            HttpResponse<Stream<String>> response = newClient().send(request, HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Task not found: " + taskId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");
        } catch (ConnectException e) {
            reportUnreachable();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }

    private void reportUnreachable() {
        ConsoleOutput.error("Cannot connect to Ozone server at localhost:" + port);
        ConsoleOutput.info("Start the server first: ozone serve");
    }

    private String baseUrl() {
        return "http://localhost:" + port + "/api/v1/tasks/" + taskId;
    }

    private static HttpClient newClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }
}
