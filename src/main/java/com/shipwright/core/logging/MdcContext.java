package com.shipwright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Shipwright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String ATTEMPT_ID = "attemptId";
    public static final String ENVIRONMENT = "environment";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setAttempt(String attemptId, String environment) {
        MDC.put(ATTEMPT_ID, attemptId);
        MDC.put(ENVIRONMENT, environment);
    }

    public static void setStage(String stage) {
        MDC.put(STAGE, stage);
    }

    public static void clear() {
        MDC.remove(ATTEMPT_ID);
        MDC.remove(ENVIRONMENT);
        MDC.remove(STAGE);
    }
}
