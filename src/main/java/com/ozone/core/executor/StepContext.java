package com.ozone.core.executor;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Execution context handed to a provider for one step.
 *
 * @param taskId                the owning task
 * @param priorOutputs          outputs of the steps completed before this rank, keyed by step name
 * @param timeout               per-attempt timeout the provider must honour
 * @param cancellationRequested true once the task has a pending cancel; checked between retries
 */
public record StepContext(
    UUID taskId,
    Map<String, String> priorOutputs,
    Duration timeout,
    BooleanSupplier cancellationRequested
) {

    public StepContext {
        priorOutputs = priorOutputs == null ? Map.of() : Map.copyOf(priorOutputs);
        if (cancellationRequested == null) {
            cancellationRequested = () -> false;
        }
    }

    public static StepContext of(UUID taskId, Duration timeout) {
        return new StepContext(taskId, Map.of(), timeout, () -> false);
    }
}
