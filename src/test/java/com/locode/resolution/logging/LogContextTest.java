package com.locode.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forQuery should set correlationId, scope and operation in MDC")
    void forQuerySetsMDC() {
        try (LogContext ctx = LogContext.forQuery("corr-123", "LOCODE@US")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("LOCODE@US", MDC.get("scope"));
            assertEquals("analyse", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forConsistency should set correlationId and operation in MDC")
    void forConsistencySetsMDC() {
        try (LogContext ctx = LogContext.forConsistency("corr-456")) {
            assertEquals("corr-456", MDC.get("correlationId"));
            assertEquals("consistency", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forImport should set source and operation in MDC")
    void forImportSetsMDC() {
        try (LogContext ctx = LogContext.forImport("catalog.json").with("batch", "1")) {
            assertEquals("catalog.json", MDC.get("source"));
            assertEquals("import", MDC.get("operation"));
            assertEquals("1", MDC.get("batch"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forQuery("corr-123", "ALL");
        assertNotNull(MDC.get("correlationId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("scope"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique IDs")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
