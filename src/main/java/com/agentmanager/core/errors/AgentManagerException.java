package com.agentmanager.core.errors;

/**
 * Base class for failures the manager reports to callers.
 * Each subclass carries a stable {@link #code()} used in REST bodies and WebSocket error frames.
 */
public abstract class AgentManagerException extends RuntimeException {

    private final String code;

    protected AgentManagerException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AgentManagerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
