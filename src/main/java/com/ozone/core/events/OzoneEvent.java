package com.ozone.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An event emitted during task execution, used for SSE streaming and CLI output.
 * <p>
 * Step events name the step they relate to; task events never do.
 *
 * @param type      what happened
 * @param taskId    the task this event belongs to
 * @param stepId    the step this event relates to, {@code null} for task events
 * @param payload   key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record OzoneEvent(
    OzoneEventType type,
    UUID taskId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public OzoneEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (type.isStepEvent() == (stepId == null)) {
            throw new IllegalArgumentException(type.isStepEvent()
                    ? "Step event " + type + " needs a step id"
                    : "Task event " + type + " cannot carry step id " + stepId);
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static OzoneEvent forTask(OzoneEventType type, UUID taskId, Map<String, Object> payload,
                                     Instant timestamp) {
        return new OzoneEvent(type, taskId, null, payload, timestamp);
    }

    public static OzoneEvent forStep(OzoneEventType type, UUID taskId, String stepId,
                                     Map<String, Object> payload, Instant timestamp) {
        return new OzoneEvent(type, taskId, stepId, payload, timestamp);
    }

    /** The dotted wire name, e.g. {@code task.paused}. */
    public String eventType() {
        return type.wireName();
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }
}
