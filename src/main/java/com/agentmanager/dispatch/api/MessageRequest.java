package com.agentmanager.dispatch.api;

/**
 * Inbound JSON body for POST /api/sessions/{id}/messages.
 *
 * @param message text handed to the agent
 * @param force   deliver even though the session is not waiting for input
 */
public record MessageRequest(String message, Boolean force) {

    public boolean forced() {
        return Boolean.TRUE.equals(force);
    }
}
