package com.ozone.core.executor.builtin;

import com.ozone.core.executor.CapabilityProvider;
import com.ozone.core.executor.StepContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Returns its input unchanged. Useful for smoke-testing plans without real providers.
 */
@Component
@ConditionalOnProperty(name = "ozone.providers.echo.enabled", havingValue = "true", matchIfMissing = true)
public class EchoCapabilityProvider implements CapabilityProvider {

    public static final String CAPABILITY = "echo";

    @Override
    public String capability() {
        return CAPABILITY;
    }

    @Override
    public CompletableFuture<String> invoke(String input, StepContext context) {
        return CompletableFuture.completedFuture(input == null ? "" : input);
    }
}
