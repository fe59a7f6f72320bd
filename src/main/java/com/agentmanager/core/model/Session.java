package com.agentmanager.core.model;

import java.time.Instant;

/**
 * One agent run against a repo.
 * <p>
 * Provisioning fields ({@code branchName}, {@code worktreePath}, {@code containerId}) are
 * filled in by the orchestrator as the pipeline progresses; {@code status} changes only
 * through the session state machine and is frozen once terminal.
 */
public record Session(
        String id,
        String repoId,
        SessionRole role,
        SessionStatus status,
        String branchName,
        String baseBranch,
        String worktreePath,
        String containerId,
        String goalPrompt,
        String model,
        Instant createdAt,
        Instant updatedAt,
        Instant finishedAt,
        String lastKnownPrUrl
) {

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Session withStatus(SessionStatus next, Instant now) {
        return new Session(id, repoId, role, next, branchName, baseBranch, worktreePath, containerId,
                goalPrompt, model, createdAt, now, next.isTerminal() ? now : finishedAt, lastKnownPrUrl);
    }

    public Session withProvisioning(String branch, String worktree, String container, Instant now) {
        return new Session(id, repoId, role, status,
                branch != null ? branch : branchName,
                baseBranch,
                worktree != null ? worktree : worktreePath,
                container != null ? container : containerId,
                goalPrompt, model, createdAt, now, finishedAt, lastKnownPrUrl);
    }

    public Session withPrUrl(String prUrl) {
        return new Session(id, repoId, role, status, branchName, baseBranch, worktreePath, containerId,
                goalPrompt, model, createdAt, updatedAt, finishedAt, prUrl);
    }
}
