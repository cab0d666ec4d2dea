package com.planwright.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Planwright-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId) {
        MDC.put("projectId", projectId);
        MDC.remove("stage");
        MDC.remove("attempt");
    }

    public static void setStage(String projectId, String stage) {
        MDC.put("projectId", projectId);
        MDC.put("stage", stage);
        MDC.remove("attempt");
    }

    public static void setAttempt(int attempt) {
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("stage");
        MDC.remove("attempt");
    }
}
