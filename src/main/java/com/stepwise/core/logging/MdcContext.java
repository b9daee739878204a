package com.stepwise.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Stepwise-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runKey) {
        MDC.put("runKey", runKey);
    }

    public static void setStep(String runKey, String step) {
        MDC.put("runKey", runKey);
        MDC.put("step", step);
    }

    public static void setSubtask(String runKey, String subtaskId) {
        MDC.put("runKey", runKey);
        MDC.put("subtaskId", subtaskId);
    }

    public static void clear() {
        MDC.remove("runKey");
        MDC.remove("step");
        MDC.remove("subtaskId");
    }
}
