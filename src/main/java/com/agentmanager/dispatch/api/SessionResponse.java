package com.agentmanager.dispatch.api;

import com.agentmanager.core.model.Session;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * JSON response for session endpoints.
 */
public record SessionResponse(
    String id,
    @JsonProperty("repo_id") String repoId,
    String role,
    String status,
    @JsonProperty("branch_name") String branchName,
    @JsonProperty("base_branch") String baseBranch,
    @JsonProperty("worktree_path") String worktreePath,
    @JsonProperty("container_id") String containerId,
    @JsonProperty("goal_prompt") String goalPrompt,
    String model,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("last_known_pr_url") String lastKnownPrUrl
) {

    public static SessionResponse from(Session s) {
        return new SessionResponse(s.id(), s.repoId(), s.role().wireName(), s.status().wireName(),
                s.branchName(), s.baseBranch(), s.worktreePath(), s.containerId(), s.goalPrompt(), s.model(),
                s.createdAt(), s.updatedAt(), s.finishedAt(), s.lastKnownPrUrl());
    }
}
