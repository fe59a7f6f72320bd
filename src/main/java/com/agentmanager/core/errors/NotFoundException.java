package com.agentmanager.core.errors;

public class NotFoundException extends AgentManagerException {

    public NotFoundException(String kind, String id) {
        super("NOT_FOUND", kind + " not found: " + id);
    }
}
