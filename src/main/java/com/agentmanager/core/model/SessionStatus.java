package com.agentmanager.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of a session. Only the session state machine writes it.
 */
public enum SessionStatus {
    STARTING,
    RUNNING,
    WAITING,
    FINISHED,
    ERROR,
    STOPPED;

    private static final Set<SessionStatus> TERMINAL = EnumSet.of(FINISHED, ERROR, STOPPED);

    /** Statuses that count against the one-orchestrator-per-repo rule and the active session count. */
    public static final Set<SessionStatus> ACTIVE = EnumSet.of(STARTING, RUNNING, WAITING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionStatus fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
