package com.ozone.core.executor;

import com.ozone.core.logging.MdcContext;
import com.ozone.core.metrics.OzoneMetrics;
import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.FailureStrategy;
import com.ozone.core.model.RetryPolicy;
import com.ozone.core.model.Step;
import com.ozone.core.model.StepOutcome;
import com.ozone.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a single {@link Step} against its capability provider.
 * <p>
 * Every attempt, successful or not, is appended to the task history before the
 * returned future completes. Provider failures and timeouts never escape as
 * exceptions: they become FAILURE outcomes and are retried with exponential
 * backoff until the step's {@link com.ozone.core.model.RetryPolicy} is exhausted.
 * Only an unknown capability fails fast, synchronously.
 */
@Service
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final TaskRegistry taskRegistry;
    private final CapabilityRegistry capabilityRegistry;
    private final Executor workerExecutor;
    private final ScheduledExecutorService backoffScheduler;
    private final OzoneMetrics metrics;
    private final Clock clock;

    @Autowired
    public StepExecutor(TaskRegistry taskRegistry,
                        CapabilityRegistry capabilityRegistry,
                        @Qualifier("orchestrationExecutor") Executor workerExecutor,
                        @Qualifier("backoffScheduler") ScheduledExecutorService backoffScheduler,
                        @Autowired(required = false) OzoneMetrics metrics,
                        Clock clock) {
        this.taskRegistry = taskRegistry;
        this.capabilityRegistry = capabilityRegistry;
        this.workerExecutor = workerExecutor;
        this.backoffScheduler = backoffScheduler;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs {@code step} to its final outcome.
     *
     * @return future completing with the last recorded outcome: SUCCESS, SKIPPED, a terminal
     *         FAILURE, or a non-terminal FAILURE when retries were abandoned for cancellation
     * @throws com.ozone.core.model.OrchestrationException UNKNOWN_CAPABILITY, before any attempt
     */
    public CompletableFuture<StepOutcome> execute(UUID taskId, Step step, StepContext context) {
        CapabilityProvider provider = capabilityRegistry.require(step.capability());
        Step effective = step.retryPolicy() != null ? step : step.withRetryPolicy(RetryPolicy.noRetry());
        return attempt(taskId, effective, context, provider, 1);
    }

    private CompletableFuture<StepOutcome> attempt(UUID taskId, Step step, StepContext context,
                                                   CapabilityProvider provider, int attemptNumber) {
        Instant startedAt = clock.instant();
        log.debug("Dispatching step {} of task {} to '{}' (attempt {}/{})",
                step.id(), taskId, step.capability(), attemptNumber, step.retryPolicy().maxAttempts());

        return invokeWithTimeout(provider, step, context)
                .handle((output, error) -> toOutcome(step, attemptNumber, output, error, startedAt))
                .thenApply(outcome -> appendToHistory(taskId, step, outcome))
                .thenCompose(outcome -> {
                    if (!outcome.isFailure()) {
                        return CompletableFuture.completedFuture(outcome);
                    }
                    if (step.retryPolicy().hasAttemptsLeft(attemptNumber)) {
                        if (context.cancellationRequested().getAsBoolean()) {
                            log.info("Step {} of task {} not retried: cancellation pending", step.id(), taskId);
                            return CompletableFuture.completedFuture(outcome);
                        }
                        return retryAfterBackoff(taskId, step, context, provider, outcome);
                    }
                    if (step.retryPolicy().onExhausted() == FailureStrategy.SKIP) {
                        StepOutcome skipped = StepOutcome.skipped(step.id(), attemptNumber,
                                "Skipped after " + attemptNumber + " failed attempt(s): " + outcome.error(),
                                clock.instant());
                        return CompletableFuture.completedFuture(appendToHistory(taskId, step, skipped));
                    }
                    return CompletableFuture.completedFuture(outcome);
                });
    }

    private CompletableFuture<String> invokeWithTimeout(CapabilityProvider provider, Step step, StepContext context) {
        CompletableFuture<String> call;
        try {
            call = provider.invoke(step.input(), context);
            if (call == null) {
                call = CompletableFuture.failedFuture(
                        new ProviderException("Provider '" + step.capability() + "' returned no result"));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        Duration timeout = context.timeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return call;
        }
        // copy() keeps the provider's own future untouched when the timeout fires
        return call.copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private CompletableFuture<StepOutcome> retryAfterBackoff(UUID taskId, Step step, StepContext context,
                                                             CapabilityProvider provider, StepOutcome failure) {
        int failedAttempt = failure.attemptNumber();
        Duration delay = step.retryPolicy().delayAfter(failedAttempt);
        log.info("Retrying step {} of task {} in {}ms (attempt {}/{})", step.id(), taskId,
                delay.toMillis(), failedAttempt + 1, step.retryPolicy().maxAttempts());
        if (metrics != null) {
            metrics.incrementRetries(step.capability());
        }
        CompletableFuture<Void> timer = new CompletableFuture<>();
        backoffScheduler.schedule(() -> timer.complete(null), delay.toMillis(), TimeUnit.MILLISECONDS);
        return timer.thenComposeAsync(ignored -> {
            if (context.cancellationRequested().getAsBoolean()) {
                log.info("Retry of step {} of task {} abandoned: cancellation pending", step.id(), taskId);
                return CompletableFuture.completedFuture(failure);
            }
            return attempt(taskId, step, context, provider, failedAttempt + 1);
        }, workerExecutor);
    }

    private StepOutcome toOutcome(Step step, int attemptNumber, String output, Throwable error, Instant startedAt) {
        Instant finishedAt = clock.instant();
        if (error == null) {
            return StepOutcome.success(step.id(), attemptNumber, output, startedAt, finishedAt);
        }
        boolean terminal = !step.retryPolicy().hasAttemptsLeft(attemptNumber)
                && step.retryPolicy().onExhausted() == FailureStrategy.FAIL;
        return StepOutcome.failure(step.id(), attemptNumber, ErrorKind.PROVIDER_ERROR,
                describe(unwrap(error), step), terminal, startedAt, finishedAt);
    }

    private StepOutcome appendToHistory(UUID taskId, Step step, StepOutcome outcome) {
        MdcContext.setStep(taskId, step.id().toString(), step.capability());
        MdcContext.setAttempt(outcome.attemptNumber());
        try {
            taskRegistry.update(taskId, task -> task.appendOutcome(outcome));
            switch (outcome.status()) {
                case SUCCESS -> log.debug("Step {} succeeded on attempt {}", step.id(), outcome.attemptNumber());
                case FAILURE -> log.warn("Step {} failed on attempt {}{}: {}", step.id(), outcome.attemptNumber(),
                        outcome.terminal() ? " (terminal)" : "", outcome.error());
                case SKIPPED -> log.warn("Step {} skipped: {}", step.id(), outcome.error());
            }
            if (metrics != null && !outcome.isSkipped()) {
                metrics.recordStepAttempt(step.capability(), outcome.status().name().toLowerCase(), outcome.duration());
            }
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error, Step step) {
        if (error instanceof TimeoutException) {
            return "Provider '" + step.capability() + "' timed out";
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
