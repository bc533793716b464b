package com.ozone.core.config;

import com.ozone.core.engine.LinePlanner;
import com.ozone.core.engine.Planner;
import com.ozone.core.registry.InMemoryTaskRegistry;
import com.ozone.core.registry.TaskRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class OrchestrationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "orchestrationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService orchestrationExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecutorThreads()),
                daemonThreads("ozone-worker"));
    }

    @Bean(name = "backoffScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService backoffScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("ozone-backoff"));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRegistry taskRegistry(OrchestratorProperties properties, Clock clock) {
        return new InMemoryTaskRegistry(properties.getMaxTasks(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Planner planner(OrchestratorProperties properties) {
        return new LinePlanner(properties.getDefaultCapability());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
