package com.agentmanager.gateway;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the last heartbeat of each tracked session and reports the ones that have gone
 * quiet for {@code missedLimit} whole intervals.
 */
public class LivenessTracker {

    private final Duration interval;
    private final int missedLimit;
    private final ConcurrentHashMap<String, Instant> lastBeats = new ConcurrentHashMap<>();

    public LivenessTracker(Duration interval, int missedLimit) {
        this.interval = interval;
        this.missedLimit = missedLimit;
    }

    public void record(String sessionId, Instant at) {
        lastBeats.put(sessionId, at);
    }

    public void forget(String sessionId) {
        lastBeats.remove(sessionId);
    }

    public boolean isTracked(String sessionId) {
        return lastBeats.containsKey(sessionId);
    }

    public List<Expired> expired(Instant now) {
        Duration deadline = interval.multipliedBy(missedLimit);
        List<Expired> expired = new ArrayList<>();
        for (Map.Entry<String, Instant> entry : lastBeats.entrySet()) {
            Duration silence = Duration.between(entry.getValue(), now);
            if (silence.compareTo(deadline) >= 0) {
                expired.add(new Expired(entry.getKey(), entry.getValue(),
                        (int) (silence.toMillis() / interval.toMillis())));
            }
        }
        return expired;
    }

    public record Expired(String sessionId, Instant lastHeartbeatAt, int missedHeartbeats) {}
}
