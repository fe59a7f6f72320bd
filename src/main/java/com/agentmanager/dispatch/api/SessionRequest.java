package com.agentmanager.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/repos/{id}/sessions. Every field is optional.
 *
 * @param role          "implementer" (default) or "orchestrator"
 * @param baseBranch    branch to cut from; defaults to the repo's default branch
 * @param branchSuffix  last segment of the session branch name
 * @param goalPrompt    initial instruction handed to the agent
 * @param model         model alias; defaults to the configured model
 */
public record SessionRequest(
    String role,
    @JsonProperty("base_branch") String baseBranch,
    @JsonProperty("branch_suffix") String branchSuffix,
    @JsonProperty("goal_prompt") String goalPrompt,
    String model
) {}
