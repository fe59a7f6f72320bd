package com.agentmanager.dispatch.api;

import com.agentmanager.core.model.SessionEvent;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record EventResponse(
    long id,
    @JsonProperty("session_id") String sessionId,
    long seq,
    String source,
    String type,
    Map<String, Object> payload,
    Instant ts
) {

    public static EventResponse from(SessionEvent e) {
        return new EventResponse(e.id(), e.sessionId(), e.seq(), e.source().wireName(), e.type(), e.payload(), e.ts());
    }
}
