package com.chromatrace.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Chromatrace-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setIteration(String sessionId, int iteration) {
        MDC.put("sessionId", sessionId);
        MDC.put("iteration", String.valueOf(iteration));
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("iteration");
    }
}
