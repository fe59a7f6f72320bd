package com.agentmanager.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * An entry of a session's append-only event log.
 * <p>
 * {@code seq} is the only ordering key: strictly increasing, gapless and unique per session,
 * starting at 1. {@code ts} is informational.
 */
public record SessionEvent(
        long id,
        String sessionId,
        EventSource source,
        String type,
        Map<String, Object> payload,
        long seq,
        Instant ts
) {

    public SessionEvent {
        payload = payload == null ? Map.of() : payload;
    }
}
