package com.agentmanager.gateway;

import java.util.Locale;
import java.util.Optional;

public enum EnvelopeKind {
    /** Agent to gateway: Claude output or a runner lifecycle event. Gateway to client: a logged event. */
    EVENT,
    /** Client to gateway, relayed to the agent. */
    COMMAND,
    ACK,
    ERROR,
    /** Client to gateway: request replay and live events. */
    SUBSCRIBE,
    /** Gateway to client only: replay answering a subscribe. */
    SNAPSHOT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EnvelopeKind> fromWire(String value) {
        for (EnvelopeKind kind : values()) {
            if (kind.wireName().equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
