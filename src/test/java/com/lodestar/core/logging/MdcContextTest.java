package com.lodestar.core.logging;

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
    @DisplayName("setSession puts agentId and sessionId in MDC")
    void setSession() {
        MdcContext.setSession("hello", "s1");
        assertEquals("hello", MDC.get("agentId"));
        assertEquals("s1", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setIteration adds iteration and phase")
    void setIteration() {
        MdcContext.setIteration("hello", "s1", 3, "START");
        assertEquals("hello", MDC.get("agentId"));
        assertEquals("3", MDC.get("iteration"));
        assertEquals("START", MDC.get("phase"));
    }

    @Test
    @DisplayName("clear removes all lodestar MDC keys and leaves others alone")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setIteration("hello", "s1", 1, "DONE");

        MdcContext.clear();

        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("iteration"));
        assertNull(MDC.get("phase"));
        assertEquals("r-1", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
