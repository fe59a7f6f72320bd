package com.agentmanager.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing agent-manager MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setSession(String sessionId, String repoId) {
        MDC.put("sessionId", sessionId);
        MDC.put("repoId", repoId);
    }

    public static void setPhase(String phase) {
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("repoId");
        MDC.remove("phase");
    }
}
