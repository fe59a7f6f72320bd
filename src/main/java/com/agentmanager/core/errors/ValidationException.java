package com.agentmanager.core.errors;

/**
 * Thrown when a request carries an unknown role or otherwise malformed input.
 */
public class ValidationException extends AgentManagerException {

    public ValidationException(String message) {
        super("VALIDATION_FAILED", message);
    }
}
