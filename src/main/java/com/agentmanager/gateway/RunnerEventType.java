package com.agentmanager.gateway;

import java.util.List;
import java.util.Optional;

/**
 * Lifecycle events the agent runner reports, with the data fields each must carry.
 */
public enum RunnerEventType {
    PROCESS_STARTED("process.started", List.of("sessionId", "role", "model", "startedAt")),
    PROCESS_EXITED("process.exited", List.of("exitCode", "signal", "reason")),
    PROCESS_STDOUT("process.stdout", List.of()),
    PROCESS_STDERR("process.stderr", List.of()),
    PROCESS_ERROR("process.error", List.of()),
    SESSION_IDLE("session.idle", List.of()),
    SESSION_TURN_COMPLETE("session.turn_complete", List.of("stopReason", "timestamp")),
    SESSION_RESULT("session.result", List.of()),
    HEARTBEAT("heartbeat", List.of());

    private final String wireName;
    private final List<String> requiredFields;

    RunnerEventType(String wireName, List<String> requiredFields) {
        this.wireName = wireName;
        this.requiredFields = requiredFields;
    }

    public String wireName() {
        return wireName;
    }

    /** Keys that must be present in {@code data}; their values may be null. */
    public List<String> requiredFields() {
        return requiredFields;
    }

    public static Optional<RunnerEventType> fromWire(String value) {
        for (RunnerEventType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
