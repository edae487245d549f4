package com.resource.guard.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forCall should set operation and coalesceKey in MDC")
    void forCallSetsMDC() {
        try (LogContext ctx = LogContext.forCall("product:1")) {
            assertEquals("coalesce", MDC.get("operation"));
            assertEquals("product:1", MDC.get("coalesceKey"));
        }
    }

    @Test
    @DisplayName("forLock should set lock name and owner in MDC")
    void forLockSetsMDC() {
        try (LogContext ctx = LogContext.forLock("acct:42", "123-abc")) {
            assertEquals("lock", MDC.get("operation"));
            assertEquals("acct:42", MDC.get("lockName"));
            assertEquals("123-abc", MDC.get("lockOwner"));
        }
    }

    @Test
    @DisplayName("close should remove only the keys it added")
    void closeRemovesOwnKeys() {
        MDC.put("requestId", "r-1");

        try (LogContext ctx = LogContext.forCall("product:1").with("tenant", "acme")) {
            assertEquals("acme", MDC.get("tenant"));
        }

        assertNull(MDC.get("operation"));
        assertNull(MDC.get("tenant"));
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("with should skip null values")
    void skipsNull() {
        try (LogContext ctx = LogContext.forLock("acct:42", null)) {
            assertNull(MDC.get("lockOwner"));
            assertEquals("acct:42", MDC.get("lockName"));
        }
    }

    @Test
    @DisplayName("A nested context should restore the outer entries on close")
    void nestedRestoresOuter() {
        try (LogContext call = LogContext.forCall("product:1")) {
            try (LogContext lock = LogContext.forLock("acct:42", "123-abc")) {
                assertEquals("lock", MDC.get("operation"));
            }

            assertEquals("coalesce", MDC.get("operation"));
            assertEquals("product:1", MDC.get("coalesceKey"));
            assertNull(MDC.get("lockName"));
        }

        assertNull(MDC.get("operation"));
    }
}
