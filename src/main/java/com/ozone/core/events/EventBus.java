package com.ozone.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process bus for task execution events.
 * <p>
 * Task subscriptions follow the task's lifecycle: the terminal event of a task is the
 * last one its subscribers receive, after which their registrations are dropped. Kind
 * subscriptions see events of the chosen {@link OzoneEventType}s for every task, including
 * those published after a task terminated (late step outcomes, eviction).
 * <p>
 * Events are delivered on the publishing thread. A failing subscriber is logged and
 * skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<UUID, List<Consumer<OzoneEvent>>> taskSubscribers = new ConcurrentHashMap<>();

    private final List<KindSubscriber> kindSubscribers = new CopyOnWriteArrayList<>();

    public void publish(OzoneEvent event) {
        log.debug("Publishing {} for task {}", event.type(), event.taskId());

        // Removing on the terminal event hands the last delivery to whoever was subscribed.
        List<Consumer<OzoneEvent>> forTask = event.isTerminal()
                ? taskSubscribers.remove(event.taskId())
                : taskSubscribers.get(event.taskId());
        if (forTask != null) {
            forTask.forEach(subscriber -> deliver(subscriber, event));
            if (event.isTerminal()) {
                log.debug("Closed {} subscription(s) of task {} on {}", forTask.size(), event.taskId(), event.type());
            }
        }

        for (KindSubscriber subscriber : kindSubscribers) {
            if (subscriber.types.contains(event.type())) {
                deliver(subscriber.consumer, event);
            }
        }
    }

    /**
     * Subscribes to one task's events up to and including its terminal event.
     */
    public Subscription subscribe(UUID taskId, Consumer<OzoneEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> taskSubscribers.computeIfPresent(taskId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribes to events of the given kinds, whatever task they belong to.
     */
    public Subscription subscribe(Set<OzoneEventType> types, Consumer<OzoneEvent> consumer) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        var subscriber = new KindSubscriber(EnumSet.copyOf(types), consumer);
        kindSubscribers.add(subscriber);
        return () -> kindSubscribers.remove(subscriber);
    }

    /** Subscribes to every event of every task. */
    public Subscription subscribeAll(Consumer<OzoneEvent> consumer) {
        return subscribe(EnumSet.allOf(OzoneEventType.class), consumer);
    }

    /** Whether any subscriber is still registered for {@code taskId}. */
    public boolean hasSubscribers(UUID taskId) {
        return taskSubscribers.containsKey(taskId);
    }

    /** Number of tasks with at least one live subscription. */
    public int subscribedTaskCount() {
        return taskSubscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<OzoneEvent> subscriber, OzoneEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for task {}: {}", event.type(), event.taskId(), e.getMessage(), e);
        }
    }

    /** Identity-compared so that equal consumers subscribed twice unsubscribe independently. */
    private static final class KindSubscriber {
        private final Set<OzoneEventType> types;
        private final Consumer<OzoneEvent> consumer;

        private KindSubscriber(Set<OzoneEventType> types, Consumer<OzoneEvent> consumer) {
            this.types = types;
            this.consumer = consumer;
        }
    }
}
