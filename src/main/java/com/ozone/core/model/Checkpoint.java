package com.ozone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Resumption point for a task: the cursor at a step boundary plus the outputs of
 * every step completed so far, keyed by step name.
 */
public record Checkpoint(int cursor, Map<String, String> outputs, Instant writtenAt) implements Serializable {

    public Checkpoint {
        outputs = outputs == null ? Map.of() : Map.copyOf(outputs);
    }

    public static Checkpoint initial(Instant at) {
        return new Checkpoint(0, Map.of(), at);
    }
}
