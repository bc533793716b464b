package com.ozone.core.model;

/**
 * Kinds of errors surfaced by the orchestration core.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_TRANSITION,
    ALREADY_RUNNING,
    UNKNOWN_CAPABILITY,
    PROVIDER_ERROR,
    PLANNING_FAILED,
    RESOURCE_EXHAUSTED,
    NO_ASSESSMENT_AVAILABLE
}
