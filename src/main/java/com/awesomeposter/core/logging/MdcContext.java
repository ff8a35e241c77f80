package com.awesomeposter.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing orchestrator MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String THREAD_ID = "threadId";
    public static final String STEP_ID = "stepId";
    public static final String CAPABILITY_ID = "capabilityId";
    public static final String CORRELATION_ID = "correlationId";

    private MdcContext() {}

    public static void setRun(String runId, String threadId, String correlationId) {
        MDC.put(RUN_ID, runId);
        putIfPresent(THREAD_ID, threadId);
        putIfPresent(CORRELATION_ID, correlationId);
    }

    public static void setStep(String stepId, String capabilityId) {
        MDC.put(STEP_ID, stepId);
        putIfPresent(CAPABILITY_ID, capabilityId);
    }

    public static void clearStep() {
        MDC.remove(STEP_ID);
        MDC.remove(CAPABILITY_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(THREAD_ID);
        MDC.remove(CORRELATION_ID);
        clearStep();
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isBlank()) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
