package com.agentmanager.runner;

/**
 * Creates and removes the per-session git worktree.
 */
public interface WorktreeProvisioner {

    /**
     * Creates a worktree for {@code sessionId} on a new {@code branchName} cut from {@code baseBranch}.
     */
    WorktreeInfo createWorktree(String owner, String repo, String sessionId, String baseBranch, String branchName);

    /**
     * Removes the session's worktree. Succeeds silently if it does not exist.
     */
    void destroyWorktree(String sessionId);
}
