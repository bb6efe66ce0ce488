package com.auraflux.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Auraflux-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setTask(String sessionId, String taskType, String idempotencyKey, String lane) {
        MDC.put("sessionId", sessionId);
        MDC.put("taskType", taskType);
        MDC.put("idempotencyKey", idempotencyKey);
        MDC.put("lane", lane);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("taskType");
        MDC.remove("idempotencyKey");
        MDC.remove("lane");
    }
}
