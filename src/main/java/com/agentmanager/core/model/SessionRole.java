package com.agentmanager.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Role an agent session plays against its repository.
 * At most one {@link #ORCHESTRATOR} may be active per repo at a time.
 */
public enum SessionRole {
    IMPLEMENTER,
    ORCHESTRATOR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SessionRole> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (SessionRole role : values()) {
            if (role.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
