package com.ozone.core.interrupt;

import com.ozone.core.engine.Orchestrator;
import com.ozone.core.events.EventBus;
import com.ozone.core.events.OzoneEvent;
import com.ozone.core.events.OzoneEventType;
import com.ozone.core.logging.MdcContext;
import com.ozone.core.metrics.OzoneMetrics;
import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.Interruption;
import com.ozone.core.model.InterruptionType;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;
import com.ozone.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pause, resume and cancel for tasks at any point of their execution.
 * <p>
 * Requests against a RUNNING task only set {@link Task#pendingInterruption()}; the
 * task's driver applies them at the next rank boundary, so an in-flight step always
 * finishes (or exhausts its retries) first. Tasks without a driver, in PLANNING or
 * PAUSED, are cancelled immediately. Every accepted request is appended to the task's
 * interruption log.
 */
@Service
public class InterruptionController {

    private static final Logger log = LoggerFactory.getLogger(InterruptionController.class);

    private final TaskRegistry taskRegistry;
    private final Orchestrator orchestrator;
    private final EventBus eventBus;
    private final OzoneMetrics metrics;
    private final Clock clock;

    @Autowired
    public InterruptionController(TaskRegistry taskRegistry,
                                  Orchestrator orchestrator,
                                  EventBus eventBus,
                                  @Autowired(required = false) OzoneMetrics metrics,
                                  Clock clock) {
        this.taskRegistry = taskRegistry;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Task pause(UUID taskId) {
        return pause(taskId, null);
    }

    /**
     * Requests a pause at the next step boundary.
     *
     * @return the task with the pause pending
     * @throws OrchestrationException NOT_FOUND, INVALID_TRANSITION unless RUNNING or
     *         when a cancel is already pending
     */
    public Task pause(UUID taskId, String reason) {
        MdcContext.setTask(taskId);
        try {
            Interruption request = new Interruption(InterruptionType.PAUSE, reason, clock.instant());
            Task task = taskRegistry.update(taskId, t -> {
                if (t.state() != TaskState.RUNNING) {
                    throw OrchestrationException.invalidTransition(taskId, t.state(), "pause");
                }
                if (t.pendingInterruption() == InterruptionType.CANCEL) {
                    throw new OrchestrationException(ErrorKind.INVALID_TRANSITION,
                            "Cannot pause task " + taskId + ": cancel already pending");
                }
                return t.withPendingInterruption(InterruptionType.PAUSE).appendInterruption(request);
            });
            log.info("Pause requested for task {} at cursor {}/{}{}", taskId, task.cursor(), task.totalSteps(),
                    reasonSuffix(reason));
            recordInterruption(InterruptionType.PAUSE);
            orchestrator.ensureDriver(taskId);
            return task;
        } finally {
            MdcContext.clear();
        }
    }

    public Task resume(UUID taskId) {
        return resume(taskId, null);
    }

    /**
     * Moves a PAUSED task back to RUNNING and restarts its driver from the checkpoint.
     *
     * @throws OrchestrationException NOT_FOUND, INVALID_TRANSITION unless PAUSED
     */
    public Task resume(UUID taskId, String reason) {
        MdcContext.setTask(taskId);
        try {
            Interruption request = new Interruption(InterruptionType.RESUME, reason, clock.instant());
            Task task = taskRegistry.update(taskId, t -> {
                if (t.state() != TaskState.PAUSED) {
                    throw OrchestrationException.invalidTransition(taskId, t.state(), "resume");
                }
                return t.appendInterruption(request).transitionTo(TaskState.RUNNING);
            });
            log.info("Resuming task {} from checkpoint at cursor {}/{}{}", taskId, task.checkpoint().cursor(),
                    task.totalSteps(), reasonSuffix(reason));
            recordInterruption(InterruptionType.RESUME);
            publish(OzoneEventType.TASK_RESUMED, task, reason);
            orchestrator.ensureDriver(taskId);
            return task;
        } finally {
            MdcContext.clear();
        }
    }

    public Task cancel(UUID taskId) {
        return cancel(taskId, null);
    }

    /**
     * Cancels a non-terminal task. PLANNING and PAUSED tasks are cancelled at once; a
     * RUNNING task is cancelled by its driver at the next step boundary, discarding the
     * results of the rank in flight.
     *
     * @return the task, either CANCELLED or RUNNING with the cancel pending
     * @throws OrchestrationException NOT_FOUND, INVALID_TRANSITION when already terminal
     */
    public Task cancel(UUID taskId, String reason) {
        MdcContext.setTask(taskId);
        try {
            Interruption request = new Interruption(InterruptionType.CANCEL, reason, clock.instant());
            var previous = new AtomicReference<TaskState>();
            Task task = taskRegistry.update(taskId, t -> {
                previous.set(t.state());
                return switch (t.state()) {
                    case RUNNING -> t.withPendingInterruption(InterruptionType.CANCEL).appendInterruption(request);
                    case PLANNING, PAUSED -> t.withPendingInterruption(null)
                            .appendInterruption(request)
                            .transitionTo(TaskState.CANCELLED);
                    default -> throw OrchestrationException.invalidTransition(taskId, t.state(), "cancel");
                };
            });
            recordInterruption(InterruptionType.CANCEL);

            if (task.state() == TaskState.CANCELLED) {
                log.info("Task {} cancelled from {}{}", taskId, previous.get(), reasonSuffix(reason));
                publish(OzoneEventType.TASK_CANCELLED, task, reason);
                if (metrics != null) {
                    metrics.recordTaskResult(TaskState.CANCELLED.name());
                }
            } else {
                log.info("Cancel requested for task {} at cursor {}/{}{}", taskId, task.cursor(), task.totalSteps(),
                        reasonSuffix(reason));
                orchestrator.ensureDriver(taskId);
            }
            return task;
        } finally {
            MdcContext.clear();
        }
    }

    private void publish(OzoneEventType type, Task task, String reason) {
        var payload = new HashMap<String, Object>();
        payload.put("cursor", task.cursor());
        payload.put("totalSteps", task.totalSteps());
        if (reason != null) {
            payload.put("reason", reason);
        }
        eventBus.publish(OzoneEvent.forTask(type, task.id(), payload, clock.instant()));
    }

    private void recordInterruption(InterruptionType type) {
        if (metrics != null) {
            metrics.recordInterruption(type.name());
        }
    }

    private static String reasonSuffix(String reason) {
        return reason == null || reason.isBlank() ? "" : " (" + reason + ")";
    }
}
