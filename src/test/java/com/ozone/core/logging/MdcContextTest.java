package com.ozone.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    private final UUID taskId = UUID.fromString("6f1c2d3e-0000-4000-8000-000000000001");

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTask puts taskId in MDC")
    void setTask() {
        MdcContext.setTask(taskId);
        assertEquals(taskId.toString(), MDC.get("taskId"));
    }

    @Test
    @DisplayName("setStep puts taskId, stepId and capability in MDC")
    void setStep() {
        MdcContext.setStep(taskId, "1:step-2", "code-analysis");
        assertEquals(taskId.toString(), MDC.get("taskId"));
        assertEquals("1:step-2", MDC.get("stepId"));
        assertEquals("code-analysis", MDC.get("capability"));
    }

    @Test
    @DisplayName("clear removes all ozone MDC keys")
    void clear() {
        MdcContext.setStep(taskId, "0:step-1", "echo");
        MdcContext.setAttempt(2);
        assertEquals("2", MDC.get("attempt"));

        MdcContext.clear();

        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("stepId"));
        assertNull(MDC.get("capability"));
        assertNull(MDC.get("attempt"));
    }
}
