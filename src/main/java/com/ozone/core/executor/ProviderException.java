package com.ozone.core.executor;

/**
 * Raised by a {@link CapabilityProvider} when an invocation fails. Treated as a
 * transient error and retried according to the step's retry policy.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
