package com.ozone.core.executor;

import java.util.concurrent.CompletableFuture;

/**
 * External collaborator that performs the domain work behind one capability
 * (code analysis, text generation, ...).
 * <p>
 * Implementations complete the returned future with the step output, or complete it
 * exceptionally (typically with {@link ProviderException}) on failure. They should
 * honour {@link StepContext#timeout()}; the executor enforces it regardless.
 */
public interface CapabilityProvider {

    /** Capability identifier this provider serves, e.g. "code-analysis". */
    String capability();

    CompletableFuture<String> invoke(String input, StepContext context);
}
