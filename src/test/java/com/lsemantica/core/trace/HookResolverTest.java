package com.lsemantica.core.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HookResolverTest {

    @Test
    @DisplayName("timestamps are ISO-8601 UTC with milliseconds")
    void formatsTimestamps() {
        assertEquals("2026-02-22T10:00:00.000Z",
                HookResolver.resolveTimestamp(() -> Instant.parse("2026-02-22T10:00:00Z")));
    }

    @Test
    @DisplayName("a throwing clock falls back to system time")
    void throwingClock() {
        String timestamp = HookResolver.resolveTimestamp(() -> {
            throw new IllegalStateException("clock down");
        });
        assertTrue(timestamp.endsWith("Z"));
    }

    @Test
    @DisplayName("explicit run id wins over the factory and fallback")
    void runIdPrecedence() {
        assertEquals("explicit", HookResolver.resolveRunId(" explicit ", () -> "factory", "fallback"));
        assertEquals("factory", HookResolver.resolveRunId(null, () -> "factory", "fallback"));
        assertEquals("fallback", HookResolver.resolveRunId(null, () -> "  ", "fallback"));
        assertEquals("fallback", HookResolver.resolveRunId("", () -> {
            throw new IllegalStateException("boom");
        }, "fallback"));
        assertFalse(HookResolver.resolveRunId(null, null, null).isBlank());
    }

    @Test
    @DisplayName("feedback ids fall back to a run-scoped id")
    void feedbackIdFallback() {
        assertEquals("ft-x", HookResolver.resolveFeedbackId(() -> "ft-x", "run-1"));
        assertTrue(HookResolver.resolveFeedbackId(null, "run-1").startsWith("ft-run-1-"));
    }
}
