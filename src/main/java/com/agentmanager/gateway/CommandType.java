package com.agentmanager.gateway;

import java.util.Locale;
import java.util.Optional;

public enum CommandType {
    USER_MESSAGE,
    STOP,
    ABORT,
    /** Handled by the gateway itself and never relayed to the agent. */
    UNSUBSCRIBE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CommandType> fromWire(String value) {
        for (CommandType type : values()) {
            if (type.wireName().equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
