package com.agentmanager.core.errors;

/**
 * Thrown when a repo already has an active orchestrator session.
 */
public class ConflictException extends AgentManagerException {

    private final String repoId;

    public ConflictException(String repoId) {
        super("ORCHESTRATOR_ACTIVE", "Repo " + repoId + " already has an active orchestrator session");
        this.repoId = repoId;
    }

    public String getRepoId() {
        return repoId;
    }
}
