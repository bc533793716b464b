package com.ozone.core.model;

/**
 * Kinds of interruption a caller can request for an in-flight task.
 */
public enum InterruptionType {
    PAUSE,
    RESUME,
    CANCEL
}
