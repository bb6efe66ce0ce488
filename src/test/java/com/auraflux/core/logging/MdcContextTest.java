package com.auraflux.core.logging;

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
    @DisplayName("setSession puts sessionId in MDC")
    void setSession() {
        MdcContext.setSession("s-1");
        assertEquals("s-1", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setTask puts session, task type, key and lane in MDC")
    void setTask() {
        MdcContext.setTask("s-1", "KEYWORD_EXTRACTION", "k-1", "DEFAULT");
        assertEquals("s-1", MDC.get("sessionId"));
        assertEquals("KEYWORD_EXTRACTION", MDC.get("taskType"));
        assertEquals("k-1", MDC.get("idempotencyKey"));
        assertEquals("DEFAULT", MDC.get("lane"));
    }

    @Test
    @DisplayName("clear removes all auraflux MDC keys")
    void clear() {
        MdcContext.setTask("s-1", "KEYWORD_EXTRACTION", "k-1", "DEFAULT");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("taskType"));
        assertNull(MDC.get("idempotencyKey"));
        assertNull(MDC.get("lane"));
    }
}
