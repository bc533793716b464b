package com.ozone.core.model;

import java.io.Serializable;

/**
 * Identifies a step by its position in the plan (0-based) and a stable name.
 */
public record StepId(int position, String name) implements Serializable {

    @Override
    public String toString() {
        return position + ":" + name;
    }
}
