package com.agentmanager.core.model;

import java.time.Instant;

/**
 * Values needed to insert a session row in {@link SessionStatus#STARTING}.
 */
public record NewSession(
        String id,
        String repoId,
        SessionRole role,
        String branchName,
        String baseBranch,
        String goalPrompt,
        String model,
        Instant createdAt
) {

    public Session toSession() {
        return new Session(id, repoId, role, SessionStatus.STARTING, branchName, baseBranch,
                null, null, goalPrompt, model, createdAt, createdAt, null, null);
    }
}
