package com.agentmanager.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who produced an event: the manager itself, the agent process, or a human operator.
 */
public enum EventSource {
    MANAGER,
    AGENT,
    USER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventSource fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
