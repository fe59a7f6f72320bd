package com.agentmanager.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LivenessTrackerTest {

    private final Instant t0 = Instant.parse("2026-03-01T10:00:00Z");
    private final LivenessTracker tracker = new LivenessTracker(Duration.ofSeconds(10), 3);

    @Test
    @DisplayName("a session expires after the missed-heartbeat limit of silent intervals")
    void expiresAfterLimit() {
        tracker.record("s-1", t0);

        assertTrue(tracker.expired(t0.plusSeconds(29)).isEmpty());
        List<LivenessTracker.Expired> expired = tracker.expired(t0.plusSeconds(30));

        assertEquals(1, expired.size());
        assertEquals("s-1", expired.get(0).sessionId());
        assertEquals(t0, expired.get(0).lastHeartbeatAt());
        assertEquals(3, expired.get(0).missedHeartbeats());
    }

    @Test
    @DisplayName("each heartbeat restarts the countdown")
    void heartbeatRefreshes() {
        tracker.record("s-1", t0);
        tracker.record("s-1", t0.plusSeconds(20));

        assertTrue(tracker.expired(t0.plusSeconds(45)).isEmpty());
        assertEquals(1, tracker.expired(t0.plusSeconds(50)).size());
    }

    @Test
    @DisplayName("forgotten sessions are no longer tracked")
    void forget() {
        tracker.record("s-1", t0);
        tracker.forget("s-1");

        assertFalse(tracker.isTracked("s-1"));
        assertTrue(tracker.expired(t0.plusSeconds(600)).isEmpty());
    }
}
