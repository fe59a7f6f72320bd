package com.agentmanager.core.model;

/**
 * Read-side summary of a repo's sessions. {@code activeSessions} counts starting, running and waiting.
 */
public record RepoStats(
        int totalSessions,
        int activeSessions,
        boolean hasRunning,
        boolean hasWaiting,
        boolean hasError
) {

    public static final RepoStats EMPTY = new RepoStats(0, 0, false, false, false);
}
