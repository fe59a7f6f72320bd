package com.agentmanager.gateway;

import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.RepoStats;

/**
 * A repo with its session stats, as repo subscribers see it.
 */
public record RepoSummary(Repo repo, RepoStats stats) {}
