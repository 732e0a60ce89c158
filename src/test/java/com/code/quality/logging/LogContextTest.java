package com.code.quality.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should set run keys and remove them on close")
    void testForRun() {
        try (LogContext ctx = LogContext.forRun("analysis-1", "/repo")) {
            assertEquals("analysis-1", MDC.get("analysisId"));
            assertEquals("/repo", MDC.get("root"));
            assertEquals("analyze", MDC.get("operation"));
        }
        assertNull(MDC.get("analysisId"));
        assertNull(MDC.get("root"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Should set task keys and extra keys")
    void testForTaskWith() {
        try (LogContext ctx = LogContext.forTask("analysis-1", "parse", "/repo/a.py").with("attempt", "2")) {
            assertEquals("parse", MDC.get("operation"));
            assertEquals("/repo/a.py", MDC.get("subject"));
            assertEquals("2", MDC.get("attempt"));
        }
        assertNull(MDC.get("subject"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("Should leave unrelated MDC keys alone")
    void testUnrelatedKeys() {
        MDC.put("requestId", "r-1");
        try (LogContext ctx = LogContext.forCacheMaintenance()) {
            assertEquals("cache-maintenance", MDC.get("operation"));
        }
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("Should generate distinct analysis ids")
    void testGenerateAnalysisId() {
        String first = LogContext.generateAnalysisId();

        assertTrue(first.startsWith("analysis-"));
        assertNotEquals(first, LogContext.generateAnalysisId());
    }
}
