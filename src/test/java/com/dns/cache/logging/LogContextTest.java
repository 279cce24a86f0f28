package com.dns.cache.logging;

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
    @DisplayName("forSweep should set cacheName, sweepId, and operation in MDC")
    void forSweepSetsMDC() {
        try (LogContext ctx = LogContext.forSweep("resolver-cache")) {
            assertEquals("resolver-cache", MDC.get("cacheName"));
            assertNotNull(MDC.get("sweepId"));
            assertEquals("sweep", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forLifecycle should set cacheName and operation in MDC")
    void forLifecycleSetsMDC() {
        try (LogContext ctx = LogContext.forLifecycle("resolver-cache", "close")) {
            assertEquals("resolver-cache", MDC.get("cacheName"));
            assertEquals("close", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forSweep("resolver-cache");
        assertNotNull(MDC.get("cacheName"));

        ctx.close();

        assertNull(MDC.get("cacheName"));
        assertNull(MDC.get("sweepId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forLifecycle("resolver-cache", "create")
                .with("capacity", "10000")) {
            assertEquals("10000", MDC.get("capacity"));
        }
        assertNull(MDC.get("capacity"));
        assertNull(MDC.get("cacheName"));
    }

    @Test
    @DisplayName("Each sweep context should get its own sweepId")
    void sweepIdsUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            try (LogContext ctx = LogContext.forSweep("resolver-cache")) {
                ids.add(MDC.get("sweepId"));
            }
        }
        assertEquals(100, ids.size(), "All sweep IDs should be unique");
    }

    @Test
    @DisplayName("sweepId should be a UUID")
    void sweepIdFormat() {
        String id;
        try (LogContext ctx = LogContext.forSweep("resolver-cache")) {
            id = MDC.get("sweepId");
        }
        assertTrue(id.matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"),
                "Should be valid UUID format: " + id);
    }
}
