package com.ozone.core.config;

import com.ozone.core.model.FailureStrategy;
import com.ozone.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ozone")
public class OrchestratorProperties {

    private Executor executor = new Executor();
    private Retry retry = new Retry();
    private Registry registry = new Registry();
    private Planner planner = new Planner();
    private Providers providers = new Providers();

    // -- Executor accessors (delegate to nested) --
    public int getExecutorThreads() { return executor.threads; }
    public Duration getDefaultStepTimeout() { return executor.defaultStepTimeout; }

    // -- Registry accessors --
    public int getMaxTasks() { return registry.maxTasks; }

    // -- Planner accessors --
    public String getDefaultCapability() { return planner.defaultCapability; }

    /**
     * Retry policy applied to steps whose planner did not supply one.
     */
    public RetryPolicy defaultRetryPolicy() {
        return new RetryPolicy(retry.maxAttempts, retry.baseDelay, retry.maxDelay, retry.onExhausted);
    }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Planner getPlanner() { return planner; }
    public void setPlanner(Planner planner) { this.planner = planner; }
    public Providers getProviders() { return providers; }
    public void setProviders(Providers providers) { this.providers = providers; }

    public static class Executor {
        private int threads = 8;
        private Duration defaultStepTimeout = Duration.ofMinutes(5);

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
        public Duration getDefaultStepTimeout() { return defaultStepTimeout; }
        public void setDefaultStepTimeout(Duration defaultStepTimeout) { this.defaultStepTimeout = defaultStepTimeout; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private FailureStrategy onExhausted = FailureStrategy.FAIL;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public FailureStrategy getOnExhausted() { return onExhausted; }
        public void setOnExhausted(FailureStrategy onExhausted) { this.onExhausted = onExhausted; }
    }

    public static class Registry {
        private int maxTasks = 10_000;

        public int getMaxTasks() { return maxTasks; }
        public void setMaxTasks(int maxTasks) { this.maxTasks = maxTasks; }
    }

    public static class Planner {
        private String defaultCapability = "echo";

        public String getDefaultCapability() { return defaultCapability; }
        public void setDefaultCapability(String defaultCapability) { this.defaultCapability = defaultCapability; }
    }

    public static class Providers {
        private Echo echo = new Echo();

        public Echo getEcho() { return echo; }
        public void setEcho(Echo echo) { this.echo = echo; }
    }

    public static class Echo {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
