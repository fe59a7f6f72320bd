package com.agentmanager.runner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A GitHub pull request as {@code gh pr list --json} reports it. {@code state} is
 * {@code OPEN}, {@code CLOSED} or {@code MERGED}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequest(
        int number,
        String title,
        String state,
        String url,
        String headRefName,
        String baseRefName,
        @JsonProperty("isDraft") boolean draft,
        Instant createdAt,
        Instant updatedAt
) {}
