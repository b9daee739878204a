package com.stepwise.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runKey in MDC")
    void setRun() {
        MdcContext.setRun("STEP-2026-0001");
        assertEquals("STEP-2026-0001", MDC.get("runKey"));
    }

    @Test
    @DisplayName("setStep puts runKey and step in MDC")
    void setStep() {
        MdcContext.setStep("STEP-2026-0001", "execute");
        assertEquals("STEP-2026-0001", MDC.get("runKey"));
        assertEquals("execute", MDC.get("step"));
    }

    @Test
    @DisplayName("clear removes all stepwise MDC keys")
    void clear() {
        MdcContext.setStep("STEP-2026-0001", "validate");
        MdcContext.setSubtask("STEP-2026-0001", "task_1");
        MdcContext.clear();
        assertNull(MDC.get("runKey"));
        assertNull(MDC.get("step"));
        assertNull(MDC.get("subtaskId"));
    }
}
