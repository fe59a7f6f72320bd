package com.agentmanager.core.errors;

/**
 * Thrown when a step of the session provisioning pipeline fails.
 * By the time it reaches the caller the session is already in {@code error}
 * and acquired resources have been released.
 */
public class ProvisioningException extends AgentManagerException {

    private final String sessionId;
    private final String step;

    public ProvisioningException(String sessionId, String step, Throwable cause) {
        super("PROVISIONING_FAILED",
                "Provisioning of session " + sessionId + " failed at step '" + step + "': " + cause.getMessage(),
                cause);
        this.sessionId = sessionId;
        this.step = step;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getStep() {
        return step;
    }
}
