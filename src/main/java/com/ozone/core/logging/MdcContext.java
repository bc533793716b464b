package com.ozone.core.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility for managing Ozone-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(UUID taskId) {
        MDC.put("taskId", String.valueOf(taskId));
    }

    public static void setStep(UUID taskId, String stepId, String capability) {
        MDC.put("taskId", String.valueOf(taskId));
        MDC.put("stepId", stepId);
        MDC.put("capability", capability);
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("stepId");
        MDC.remove("capability");
        MDC.remove("attempt");
    }
}
