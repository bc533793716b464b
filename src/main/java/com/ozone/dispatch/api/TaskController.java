package com.ozone.dispatch.api;

import com.ozone.core.assessment.AssessmentService;
import com.ozone.core.engine.Orchestrator;
import com.ozone.core.interrupt.InterruptionController;
import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;
import com.ozone.core.progress.ProgressReporter;
import com.ozone.core.registry.TaskFilter;
import com.ozone.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * REST controller for task lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final Orchestrator orchestrator;
    private final InterruptionController interruptionController;
    private final ProgressReporter progressReporter;
    private final AssessmentService assessmentService;
    private final TaskRegistry taskRegistry;
    private final SseStreamingService sseStreamingService;

    public TaskController(Orchestrator orchestrator,
                          InterruptionController interruptionController,
                          ProgressReporter progressReporter,
                          AssessmentService assessmentService,
                          TaskRegistry taskRegistry,
                          SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.interruptionController = interruptionController;
        this.progressReporter = progressReporter;
        this.assessmentService = assessmentService;
        this.taskRegistry = taskRegistry;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/tasks: plans the objective and starts execution in the background.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitTask(@RequestBody TaskRequest request) {
        if (request == null || request.objective() == null || request.objective().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Objective is required"));
        }
        UUID taskId = orchestrator.submitTask(request.objective());
        Task task = orchestrator.getTask(taskId);
        log.info("Accepted task {} ({} step(s))", taskId, task.totalSteps());
        return ResponseEntity.accepted().body(Map.of(
                "task_id", taskId.toString(),
                "state", task.state().name(),
                "events_url", "/api/v1/tasks/" + taskId + "/events"));
    }

    /**
     * GET /api/v1/tasks: lists tasks, optionally restricted to one state.
     */
    @GetMapping
    public ResponseEntity<?> listTasks(@RequestParam(name = "state", required = false) String state) {
        TaskFilter filter;
        if (state == null || state.isBlank()) {
            filter = TaskFilter.all();
        } else {
            try {
                filter = TaskFilter.inState(TaskState.valueOf(state.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid state: " + state));
            }
        }
        List<TaskResponse.Summary> tasks = taskRegistry.list(filter)
                .map(taskRegistry::find)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(Task::createdAt))
                .map(TaskResponse.Summary::from)
                .toList();
        return ResponseEntity.ok(tasks);
    }

    @GetMapping("/{id}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable UUID id) {
        return ResponseEntity.ok(TaskResponse.from(orchestrator.getTask(id)));
    }

    @GetMapping("/{id}/progress")
    public ResponseEntity<ProgressResponse> getProgress(@PathVariable UUID id) {
        return ResponseEntity.ok(ProgressResponse.from(progressReporter.report(id)));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<TaskResponse> pause(@PathVariable UUID id,
                                              @RequestBody(required = false) InterruptRequest request) {
        return ResponseEntity.ok(TaskResponse.from(interruptionController.pause(id, reasonOf(request))));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<TaskResponse> resume(@PathVariable UUID id,
                                               @RequestBody(required = false) InterruptRequest request) {
        return ResponseEntity.ok(TaskResponse.from(interruptionController.resume(id, reasonOf(request))));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TaskResponse> cancel(@PathVariable UUID id,
                                               @RequestBody(required = false) InterruptRequest request) {
        return ResponseEntity.ok(TaskResponse.from(interruptionController.cancel(id, reasonOf(request))));
    }

    @GetMapping("/{id}/assessment")
    public ResponseEntity<AssessmentResponse> getAssessment(@PathVariable UUID id) {
        return ResponseEntity.ok(AssessmentResponse.from(assessmentService.getAssessment(id)));
    }

    /**
     * GET /api/v1/tasks/{id}/events: Server-Sent Events for the task's execution.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable UUID id) {
        if (taskRegistry.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * DELETE /api/v1/tasks/{id}: evicts a terminal task.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> evict(@PathVariable UUID id) {
        Task evicted = orchestrator.evict(id);
        return ResponseEntity.ok(Map.of(
                "task_id", id.toString(),
                "state", evicted.state().name(),
                "status", "evicted"));
    }

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<Map<String, String>> handleOrchestrationException(OrchestrationException e) {
        HttpStatus status = statusFor(e.kind());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", e.kind(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.kind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of(
                "error", String.valueOf(e.getMessage()),
                "kind", e.kind().name()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION, ALREADY_RUNNING -> HttpStatus.CONFLICT;
            case PLANNING_FAILED, UNKNOWN_CAPABILITY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case RESOURCE_EXHAUSTED -> HttpStatus.SERVICE_UNAVAILABLE;
            case NO_ASSESSMENT_AVAILABLE -> HttpStatus.FAILED_DEPENDENCY;
            case PROVIDER_ERROR -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static String reasonOf(InterruptRequest request) {
        return request != null ? request.reason() : null;
    }
}
