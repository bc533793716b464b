package com.ozone.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Retry settings for a single step.
 *
 * @param maxAttempts total attempts allowed, including the first (at least 1)
 * @param baseDelay   delay before the second attempt; doubles for every further attempt
 * @param maxDelay    upper bound for any single backoff delay
 * @param onExhausted what to do once all attempts have failed
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    FailureStrategy onExhausted
) implements Serializable {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (onExhausted == null) {
            onExhausted = FailureStrategy.FAIL;
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, FailureStrategy.FAIL);
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, FailureStrategy.FAIL);
    }

    /**
     * Backoff before the attempt following {@code failedAttempt} (1-based):
     * {@code baseDelay * 2^(failedAttempt - 1)}, capped at {@code maxDelay}.
     */
    public Duration delayAfter(int failedAttempt) {
        int exponent = Math.max(0, failedAttempt - 1);
        if (exponent >= 31) {
            return maxDelay;
        }
        long multiplier = 1L << exponent;
        long baseMillis = baseDelay.toMillis();
        if (baseMillis > 0 && multiplier > Long.MAX_VALUE / baseMillis) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(baseMillis * multiplier);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
