package me.golemcore.companion.security;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SenderSecurityTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");
    private static final Duration WINDOW = Duration.ofSeconds(60);

    @Test
    void recordRequest_countsRequestsInsideWindow() {
        SenderSecurity sender = new SenderSecurity();

        RequestWindowCheck first = sender.recordRequest(FIXED_TIME, 2, WINDOW);
        RequestWindowCheck second = sender.recordRequest(FIXED_TIME.plusSeconds(10), 2, WINDOW);

        assertTrue(first.allowed());
        assertTrue(second.allowed());
        assertEquals(2, second.requestsInWindow());
        assertNull(second.retryAt());
    }

    @Test
    void recordRequest_overLimitReportsWhenOldestRequestLeavesWindow() {
        SenderSecurity sender = new SenderSecurity();
        sender.recordRequest(FIXED_TIME, 2, WINDOW);
        sender.recordRequest(FIXED_TIME.plusSeconds(10), 2, WINDOW);

        RequestWindowCheck third = sender.recordRequest(FIXED_TIME.plusSeconds(20), 2, WINDOW);

        assertFalse(third.allowed());
        assertEquals(3, third.requestsInWindow());
        assertEquals(FIXED_TIME.plusSeconds(60), third.retryAt());
        assertTrue(third.describe().startsWith("More than 2 requests in PT1M"));
    }

    @Test
    void recordRequest_oldRequestsFallOutOfWindow() {
        SenderSecurity sender = new SenderSecurity();
        sender.recordRequest(FIXED_TIME, 1, WINDOW);

        RequestWindowCheck later = sender.recordRequest(FIXED_TIME.plusSeconds(61), 1, WINDOW);

        assertTrue(later.allowed());
        assertEquals(1, later.requestsInWindow());
    }
}
