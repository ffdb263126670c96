package com.lodestar.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Lodestar-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String agentId, String sessionId) {
        MDC.put("agentId", agentId);
        MDC.put("sessionId", sessionId);
    }

    public static void setIteration(String agentId, String sessionId, int iteration, String phase) {
        setSession(agentId, sessionId);
        MDC.put("iteration", String.valueOf(iteration));
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("sessionId");
        MDC.remove("iteration");
        MDC.remove("phase");
    }
}
