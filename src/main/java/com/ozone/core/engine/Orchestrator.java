package com.ozone.core.engine;

import com.ozone.core.config.OrchestratorProperties;
import com.ozone.core.events.EventBus;
import com.ozone.core.events.OzoneEvent;
import com.ozone.core.events.OzoneEventType;
import com.ozone.core.executor.CapabilityRegistry;
import com.ozone.core.executor.StepContext;
import com.ozone.core.executor.StepExecutor;
import com.ozone.core.logging.MdcContext;
import com.ozone.core.metrics.OzoneMetrics;
import com.ozone.core.model.Checkpoint;
import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.InterruptionType;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.Plan;
import com.ozone.core.model.RetryPolicy;
import com.ozone.core.model.Step;
import com.ozone.core.model.StepOutcome;
import com.ozone.core.model.Task;
import com.ozone.core.model.TaskState;
import com.ozone.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Plans submitted tasks and drives them through their steps.
 * <p>
 * Each task has at most one active driver, tracked in {@link #activeDrives}. A driver
 * runs rank after rank on the orchestration executor without blocking a thread while
 * providers work; pending pause and cancel requests are applied only at rank
 * boundaries. All task mutations go through the {@link TaskRegistry}.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final TaskRegistry taskRegistry;
    private final Planner planner;
    private final StepExecutor stepExecutor;
    private final CapabilityRegistry capabilityRegistry;
    private final EventBus eventBus;
    private final OzoneMetrics metrics;
    private final Executor workerExecutor;
    private final OrchestratorProperties properties;
    private final Clock clock;

    /** Completion future of the live driver, per task. */
    private final ConcurrentHashMap<UUID, CompletableFuture<Task>> activeDrives = new ConcurrentHashMap<>();

    @Autowired
    public Orchestrator(TaskRegistry taskRegistry,
                        Planner planner,
                        StepExecutor stepExecutor,
                        CapabilityRegistry capabilityRegistry,
                        EventBus eventBus,
                        @Autowired(required = false) OzoneMetrics metrics,
                        @Qualifier("orchestrationExecutor") Executor workerExecutor,
                        OrchestratorProperties properties,
                        Clock clock) {
        this.taskRegistry = taskRegistry;
        this.planner = planner;
        this.stepExecutor = stepExecutor;
        this.capabilityRegistry = capabilityRegistry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a task, plans it synchronously and starts driving it in the background.
     *
     * @return the new task id; the task is RUNNING (or already CANCELLED if a cancel
     *         arrived while planning)
     * @throws OrchestrationException RESOURCE_EXHAUSTED when the registry is full,
     *         PLANNING_FAILED or UNKNOWN_CAPABILITY when the plan is unusable (the task
     *         is left FAILED in the registry for diagnosis)
     */
    public UUID submitTask(String objective) {
        if (objective == null || objective.isBlank()) {
            throw new OrchestrationException(ErrorKind.PLANNING_FAILED, "Objective must not be blank");
        }
        UUID taskId = taskRegistry.createTask(objective);
        MdcContext.setTask(taskId);
        try {
            log.info("Submitted task {}", taskId);
            publish(OzoneEventType.TASK_SUBMITTED, taskId, Map.of("objective", objective));

            Plan plan = planTask(taskId, objective);

            Task planned = taskRegistry.update(taskId, task -> task.state() == TaskState.PLANNING
                    ? task.withPlan(plan).transitionTo(TaskState.RUNNING)
                    : task);
            if (planned.state() != TaskState.RUNNING) {
                log.info("Task {} left {} during planning", taskId, planned.state());
                return taskId;
            }

            log.info("Task {} planned: {} step(s), strategy {}", taskId, plan.steps().size(), plan.strategy());
            publish(OzoneEventType.TASK_RUNNING, taskId, Map.of(
                    "totalSteps", plan.steps().size(),
                    "strategy", plan.strategy().name()));
            ensureDriver(taskId);
            return taskId;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Starts the drive loop for a RUNNING task.
     *
     * @return future completing with the task snapshot once this driver stops
     *         (COMPLETED, FAILED, CANCELLED or PAUSED)
     * @throws OrchestrationException NOT_FOUND, INVALID_TRANSITION unless RUNNING,
     *         ALREADY_RUNNING when another driver is active for the task
     */
    public CompletableFuture<Task> drive(UUID taskId) {
        Task task = taskRegistry.get(taskId);
        if (task.state() != TaskState.RUNNING) {
            throw OrchestrationException.invalidTransition(taskId, task.state(), "drive");
        }
        CompletableFuture<Task> completion = new CompletableFuture<>();
        if (activeDrives.putIfAbsent(taskId, completion) != null) {
            throw new OrchestrationException(ErrorKind.ALREADY_RUNNING,
                    "Task " + taskId + " already has an active driver");
        }
        log.debug("Driver started for task {}", taskId);
        schedule(taskId, completion);
        return completion;
    }

    /**
     * Makes sure a RUNNING task has a driver, starting one if none is active.
     *
     * @return the live driver's completion, or the current snapshot when the task is not RUNNING
     */
    public CompletableFuture<Task> ensureDriver(UUID taskId) {
        Task task = taskRegistry.get(taskId);
        if (task.state() != TaskState.RUNNING) {
            return CompletableFuture.completedFuture(task);
        }
        try {
            return drive(taskId);
        } catch (OrchestrationException e) {
            if (e.kind() != ErrorKind.ALREADY_RUNNING && e.kind() != ErrorKind.INVALID_TRANSITION) {
                throw e;
            }
            return completion(taskId);
        }
    }

    /**
     * Future that completes when the task's current driver stops, or immediately with
     * the current snapshot when no driver is active.
     */
    public CompletableFuture<Task> completion(UUID taskId) {
        CompletableFuture<Task> active = activeDrives.get(taskId);
        if (active != null) {
            return active;
        }
        return CompletableFuture.completedFuture(taskRegistry.get(taskId));
    }

    public boolean isDriving(UUID taskId) {
        return activeDrives.containsKey(taskId);
    }

    public Task getTask(UUID taskId) {
        return taskRegistry.get(taskId);
    }

    /**
     * Removes a terminal task from the registry and announces it, so that holders of
     * per-task state such as cached assessments can drop theirs.
     *
     * @throws OrchestrationException NOT_FOUND, INVALID_TRANSITION unless terminal
     */
    public Task evict(UUID taskId) {
        Task evicted = taskRegistry.evict(taskId);
        log.info("Evicted task {} ({})", taskId, evicted.state());
        publish(OzoneEventType.TASK_EVICTED, taskId, Map.of("state", evicted.state().name()));
        return evicted;
    }

    // ── Planning ──────────────────────────────────────────────────────

    private Plan planTask(UUID taskId, String objective) {
        long start = System.currentTimeMillis();
        Plan plan;
        try {
            plan = planner.plan(objective);
            if (plan == null) {
                throw new PlanningException("Planner returned no plan");
            }
            RankResolver.validate(plan);
        } catch (PlanningException e) {
            throw failPlanning(taskId, ErrorKind.PLANNING_FAILED, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw failPlanning(taskId, ErrorKind.PLANNING_FAILED, "Planner error: " + e.getMessage(), e);
        } finally {
            if (metrics != null) {
                metrics.recordPlanningDuration(System.currentTimeMillis() - start);
            }
        }

        for (Step step : plan.steps()) {
            if (!capabilityRegistry.supports(step.capability())) {
                throw failPlanning(taskId, ErrorKind.UNKNOWN_CAPABILITY,
                        "No provider registered for capability '" + step.capability() + "' (step " + step.id() + ")",
                        null);
            }
        }
        return withDefaults(plan);
    }

    private Plan withDefaults(Plan plan) {
        RetryPolicy defaultPolicy = properties.defaultRetryPolicy();
        Duration defaultTimeout = properties.getDefaultStepTimeout();
        var steps = new ArrayList<Step>(plan.steps().size());
        for (Step step : plan.steps()) {
            Step resolved = step;
            if (resolved.retryPolicy() == null) {
                resolved = resolved.withRetryPolicy(defaultPolicy);
            }
            if (resolved.timeout() == null) {
                resolved = resolved.withTimeout(defaultTimeout);
            }
            steps.add(resolved);
        }
        return new Plan(steps, plan.strategy());
    }

    private OrchestrationException failPlanning(UUID taskId, ErrorKind kind, String message, Throwable cause) {
        log.warn("Planning failed for task {}: {}", taskId, message);
        Task failed = taskRegistry.update(taskId, task -> task.state() == TaskState.PLANNING
                ? task.transitionTo(TaskState.FAILED)
                : task);
        if (failed.state() == TaskState.FAILED) {
            publish(OzoneEventType.TASK_FAILED, taskId, Map.of("reason", String.valueOf(message)));
            recordTaskResult(failed);
        }
        String detail = "Task " + taskId + ": " + message;
        return cause != null ? new OrchestrationException(kind, detail, cause) : new OrchestrationException(kind, detail);
    }

    // ── Drive loop ────────────────────────────────────────────────────

    private void schedule(UUID taskId, CompletableFuture<Task> completion) {
        try {
            workerExecutor.execute(() -> runIteration(taskId, completion));
        } catch (RejectedExecutionException e) {
            failUnexpected(taskId, completion, e);
        }
    }

    /** One loop iteration: settle at the boundary or dispatch the next rank. */
    private void runIteration(UUID taskId, CompletableFuture<Task> completion) {
        MdcContext.setTask(taskId);
        try {
            Task settled = settleAtBoundary(taskId);
            if (settled.state() != TaskState.RUNNING) {
                finishDrive(taskId, completion, settled);
                return;
            }

            RankResolver.StepRange range = RankResolver.rankAt(settled);
            List<Step> rank = settled.plan().subList(range.start(), range.end());
            if (metrics != null) {
                metrics.recordRankSize(rank.size(), settled.strategy().name());
            }
            dispatchRank(settled, rank).whenCompleteAsync((outcomes, error) -> {
                MdcContext.setTask(taskId);
                try {
                    if (error != null) {
                        failUnexpected(taskId, completion, error);
                        return;
                    }
                    Task after = applyRankResult(taskId, range, outcomes);
                    if (after.state() == TaskState.RUNNING) {
                        schedule(taskId, completion);
                    } else {
                        finishDrive(taskId, completion, after);
                    }
                } catch (RuntimeException e) {
                    failUnexpected(taskId, completion, e);
                } finally {
                    MdcContext.clear();
                }
            }, workerExecutor);
        } catch (RuntimeException e) {
            failUnexpected(taskId, completion, e);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Applies a pending cancel or pause, or completes a task whose cursor reached the end.
     */
    private Task settleAtBoundary(UUID taskId) {
        var previous = new AtomicReference<TaskState>();
        Task task = taskRegistry.update(taskId, t -> {
            previous.set(t.state());
            if (t.state() != TaskState.RUNNING) {
                return t;
            }
            if (t.pendingInterruption() == InterruptionType.CANCEL) {
                return t.withPendingInterruption(null).transitionTo(TaskState.CANCELLED);
            }
            if (t.isFinished()) {
                return t.withPendingInterruption(null).transitionTo(TaskState.COMPLETED);
            }
            if (t.pendingInterruption() == InterruptionType.PAUSE) {
                return t.withCheckpoint(new Checkpoint(t.cursor(), t.checkpoint().outputs(), clock.instant()))
                        .withPendingInterruption(null)
                        .transitionTo(TaskState.PAUSED);
            }
            return t;
        });
        if (previous.get() == TaskState.RUNNING && task.state() != TaskState.RUNNING) {
            announceTransition(task);
        }
        return task;
    }

    private CompletableFuture<List<StepOutcome>> dispatchRank(Task task, List<Step> rank) {
        UUID taskId = task.id();
        Map<String, String> priorOutputs = task.checkpoint().outputs();
        var futures = new ArrayList<CompletableFuture<StepOutcome>>(rank.size());

        for (Step step : rank) {
            Duration timeout = step.timeout() != null ? step.timeout() : properties.getDefaultStepTimeout();
            var context = new StepContext(taskId, priorOutputs, timeout, () -> isCancelPending(taskId));
            eventBus.publish(OzoneEvent.forStep(OzoneEventType.STEP_STARTED, taskId, step.id().toString(),
                    Map.of("capability", step.capability(), "rankSize", rank.size()), clock.instant()));
            CompletableFuture<StepOutcome> future;
            try {
                future = stepExecutor.execute(taskId, step, context);
            } catch (OrchestrationException e) {
                StepOutcome rejected = StepOutcome.failure(step.id(), 1, e.kind(), e.getMessage(), true,
                        clock.instant(), clock.instant());
                taskRegistry.update(taskId, t -> t.appendOutcome(rejected));
                future = CompletableFuture.completedFuture(rejected);
            }
            futures.add(future.whenComplete((outcome, error) -> {
                if (outcome != null) {
                    publishOutcome(taskId, outcome);
                }
            }));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Advances the cursor past a settled rank, completing the task when that rank was the
     * last one, or fails or cancels the task without advancing it.
     */
    private Task applyRankResult(UUID taskId, RankResolver.StepRange range, List<StepOutcome> outcomes) {
        boolean rankFailed = outcomes.stream().anyMatch(StepOutcome::isFailure);
        var previous = new AtomicReference<TaskState>();

        Task task = taskRegistry.update(taskId, t -> {
            previous.set(t.state());
            if (t.state() != TaskState.RUNNING) {
                return t;
            }
            if (t.pendingInterruption() == InterruptionType.CANCEL) {
                return t.withPendingInterruption(null).transitionTo(TaskState.CANCELLED);
            }
            if (rankFailed) {
                return t.withPendingInterruption(null).transitionTo(TaskState.FAILED);
            }
            var outputs = new HashMap<>(t.checkpoint().outputs());
            for (StepOutcome outcome : outcomes) {
                if (outcome.isSuccess() && outcome.output() != null) {
                    outputs.put(outcome.stepId().name(), outcome.output());
                }
            }
            Task advanced = t.withCursor(range.end())
                    .withCheckpoint(new Checkpoint(range.end(), outputs, clock.instant()));
            // A pending pause cannot hold back the last rank.
            return advanced.isFinished()
                    ? advanced.withPendingInterruption(null).transitionTo(TaskState.COMPLETED)
                    : advanced;
        });

        if (previous.get() == TaskState.RUNNING && task.state() != TaskState.RUNNING) {
            announceTransition(task);
        } else if (task.state() == TaskState.RUNNING) {
            log.debug("Task {} advanced to cursor {}/{}", taskId, task.cursor(), task.totalSteps());
        }
        return task;
    }

    private boolean isCancelPending(UUID taskId) {
        return taskRegistry.find(taskId)
                .map(t -> t.pendingInterruption() == InterruptionType.CANCEL || t.state() == TaskState.CANCELLED)
                .orElse(true);
    }

    /**
     * Releases the driver slot, then hands off to a new driver if the task was resumed
     * while this one was stopping.
     */
    private void finishDrive(UUID taskId, CompletableFuture<Task> completion, Task task) {
        activeDrives.remove(taskId, completion);
        log.debug("Driver stopped for task {} in state {}", taskId, task.state());
        completion.complete(task);

        taskRegistry.find(taskId)
                .filter(latest -> latest.state() == TaskState.RUNNING)
                .ifPresent(latest -> ensureDriver(taskId));
    }

    private void failUnexpected(UUID taskId, CompletableFuture<Task> completion, Throwable error) {
        log.error("Drive loop for task {} failed unexpectedly", taskId, error);
        Task task;
        try {
            var previous = new AtomicReference<TaskState>();
            task = taskRegistry.update(taskId, t -> {
                previous.set(t.state());
                return t.state() == TaskState.RUNNING
                        ? t.withPendingInterruption(null).transitionTo(TaskState.FAILED)
                        : t;
            });
            if (previous.get() == TaskState.RUNNING && task.state() == TaskState.FAILED) {
                announceTransition(task);
            }
        } catch (RuntimeException e) {
            log.error("Could not mark task {} as failed", taskId, e);
            activeDrives.remove(taskId, completion);
            completion.completeExceptionally(error);
            return;
        }
        activeDrives.remove(taskId, completion);
        completion.complete(task);
    }

    // ── Events ────────────────────────────────────────────────────────

    private void announceTransition(Task task) {
        log.info("Task {} is {} at cursor {}/{}", task.id(), task.state(), task.cursor(), task.totalSteps());
        publish(OzoneEventType.forState(task.state()), task.id(), Map.of(
                "cursor", task.cursor(),
                "totalSteps", task.totalSteps()));
        if (task.state().isTerminal()) {
            recordTaskResult(task);
        }
    }

    private void publishOutcome(UUID taskId, StepOutcome outcome) {
        var payload = new HashMap<String, Object>();
        payload.put("attempt", outcome.attemptNumber());
        payload.put("status", outcome.status().name());
        payload.put("durationMs", outcome.duration().toMillis());
        if (outcome.error() != null) {
            payload.put("error", outcome.error());
        }
        OzoneEventType type = outcome.isFailure() ? OzoneEventType.STEP_FAILED : OzoneEventType.STEP_COMPLETED;
        eventBus.publish(OzoneEvent.forStep(type, taskId, outcome.stepId().toString(), payload, clock.instant()));
    }

    private void publish(OzoneEventType type, UUID taskId, Map<String, Object> payload) {
        eventBus.publish(OzoneEvent.forTask(type, taskId, payload, clock.instant()));
    }

    private void recordTaskResult(Task task) {
        if (metrics != null) {
            metrics.recordTaskResult(task.state().name());
        }
    }
}
