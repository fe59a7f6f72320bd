package com.agentmanager.dispatch.api;

import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.RepoStats;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * JSON response for repo endpoints, with session statistics.
 */
public record RepoResponse(
    String id,
    String owner,
    String name,
    @JsonProperty("full_name") String fullName,
    @JsonProperty("default_branch") String defaultBranch,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_activity_at") Instant lastActivityAt,
    Stats stats
) {

    public static RepoResponse from(Repo repo, RepoStats stats) {
        return new RepoResponse(repo.id(), repo.owner(), repo.name(), repo.fullName(), repo.defaultBranch(),
                repo.createdAt(), repo.lastActivityAt(),
                new Stats(stats.totalSessions(), stats.activeSessions(),
                        stats.hasRunning(), stats.hasWaiting(), stats.hasError()));
    }

    public record Stats(
        @JsonProperty("total_sessions") int totalSessions,
        @JsonProperty("active_sessions") int activeSessions,
        @JsonProperty("has_running") boolean hasRunning,
        @JsonProperty("has_waiting") boolean hasWaiting,
        @JsonProperty("has_error") boolean hasError
    ) {}
}
