package com.agentmanager.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/repos.
 *
 * @param owner         GitHub owner or organisation
 * @param name          repository name
 * @param defaultBranch branch new sessions are cut from; nullable, defaults to "main"
 */
public record RepoRequest(
    String owner,
    String name,
    @JsonProperty("default_branch") String defaultBranch
) {}
