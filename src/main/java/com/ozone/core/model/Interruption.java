package com.ozone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Audit entry for an accepted pause, resume or cancel request.
 *
 * @param type        what was requested
 * @param reason      free-text reason supplied by the caller (nullable)
 * @param requestedAt when the request was accepted
 */
public record Interruption(
    InterruptionType type,
    String reason,
    Instant requestedAt
) implements Serializable {}
