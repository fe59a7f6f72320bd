package com.agentmanager.core.model;

import java.time.Instant;

public record Repo(
        String id,
        String owner,
        String name,
        String defaultBranch,
        Instant createdAt,
        Instant updatedAt,
        Instant lastActivityAt
) {

    public String fullName() {
        return owner + "/" + name;
    }
}
