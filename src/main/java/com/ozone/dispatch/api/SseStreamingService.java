package com.ozone.dispatch.api;

import com.ozone.core.events.EventBus;
import com.ozone.core.events.OzoneEvent;
import com.ozone.core.events.OzoneEventType;
import com.ozone.core.model.Task;
import com.ozone.core.registry.TaskRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams a task's execution events to SSE clients.
 * <p>
 * A stream ends with the task: on its terminal event, or straight away when the client
 * connects to a task that already finished, in which case the final state is sent as the
 * only event. SSE ids count the events of one stream from 1.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final TaskRegistry taskRegistry;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<TaskStream> openStreams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, TaskRegistry taskRegistry) {
        this(eventBus, taskRegistry, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, TaskRegistry taskRegistry, long timeoutMs) {
        this.eventBus = eventBus;
        this.taskRegistry = taskRegistry;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
        openStreams.forEach(TaskStream::finish);
    }

    /**
     * Opens a stream of the task's events.
     *
     * @throws com.ozone.core.model.OrchestrationException NOT_FOUND for an unknown task
     */
    public SseEmitter createEmitter(UUID taskId) {
        Task current = taskRegistry.get(taskId);
        var stream = new TaskStream(taskId, new SseEmitter(timeoutMs));

        if (current.state().isTerminal()) {
            stream.closeWithState(current);
            log.debug("Task {} already {}; stream closed after its final state", taskId, current.state());
            return stream.emitter;
        }

        stream.subscription = eventBus.subscribe(taskId, stream::onEvent);
        openStreams.add(stream);
        stream.emitter.onCompletion(stream::release);
        stream.emitter.onTimeout(() -> {
            log.debug("SSE stream for task {} timed out", taskId);
            stream.release();
        });
        stream.emitter.onError(ex -> stream.release());
        stream.comment("connected");

        // The terminal event may have been published before the subscription existed.
        taskRegistry.find(taskId)
                .filter(task -> task.state().isTerminal())
                .ifPresent(stream::closeWithState);

        log.info("SSE stream opened for task {} ({} open)", taskId, openStreams.size());
        return stream.emitter;
    }

    public int openStreamCount() {
        return openStreams.size();
    }

    private void sendHeartbeats() {
        for (TaskStream stream : openStreams) {
            stream.comment("heartbeat");
        }
    }

    /** One client's view of one task. */
    private final class TaskStream {
        private final UUID taskId;
        private final SseEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean();
        private final AtomicLong sequence = new AtomicLong();
        private volatile EventBus.Subscription subscription;

        private TaskStream(UUID taskId, SseEmitter emitter) {
            this.taskId = taskId;
            this.emitter = emitter;
        }

        void onEvent(OzoneEvent event) {
            if (closed.get()) {
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("taskId", taskId.toString());
            if (event.stepId() != null) {
                data.put("stepId", event.stepId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            if (event.isTerminal()) {
                if (closed.compareAndSet(false, true)) {
                    send(event.type(), data);
                    finish();
                }
            } else {
                send(event.type(), data);
            }
        }

        void closeWithState(Task task) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("taskId", taskId.toString());
            data.put("cursor", task.cursor());
            data.put("totalSteps", task.totalSteps());
            data.put("timestamp", task.updatedAt().toString());
            send(OzoneEventType.forState(task.state()), data);
            finish();
        }

        void comment(String text) {
            try {
                emitter.send(SseEmitter.event().comment(text));
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE comment to task {} stream failed: {}", taskId, e.getMessage());
            }
        }

        private void send(OzoneEventType type, Map<String, Object> data) {
            try {
                emitter.send(SseEmitter.event()
                        .id(Long.toString(sequence.incrementAndGet()))
                        .name(type.wireName())
                        .data(data));
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE {} for task {} not delivered: {}", type, taskId, e.getMessage());
            }
        }

        private void finish() {
            emitter.complete();
            release();
        }

        void release() {
            closed.set(true);
            if (openStreams.remove(this)) {
                EventBus.Subscription current = subscription;
                if (current != null) {
                    current.unsubscribe();
                }
                log.debug("SSE stream for task {} released", taskId);
            }
        }
    }
}
