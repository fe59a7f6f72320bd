package com.agentmanager.core.logging;

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
    @DisplayName("setSession puts sessionId and repoId in MDC")
    void setSession() {
        MdcContext.setSession("s-1", "r-1");
        assertEquals("s-1", MDC.get("sessionId"));
        assertEquals("r-1", MDC.get("repoId"));
    }

    @Test
    @DisplayName("setPhase puts phase in MDC")
    void setPhase() {
        MdcContext.setPhase("startup");
        assertEquals("startup", MDC.get("phase"));
    }

    @Test
    @DisplayName("clear removes all agent-manager MDC keys and nothing else")
    void clear() {
        MDC.put("other", "keep");
        MdcContext.setSession("s-1", "r-1");
        MdcContext.setPhase("liveness");

        MdcContext.clear();

        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("repoId"));
        assertNull(MDC.get("phase"));
        assertEquals("keep", MDC.get("other"));
        MDC.remove("other");
    }
}
