package com.agentmanager.runner;

import java.util.Optional;

/**
 * Finds the pull request opened from a session branch.
 */
public interface PullRequestFinder {

    /**
     * Returns the newest pull request whose head is {@code branch}, in any state, or empty when
     * there is none or GitHub cannot be asked.
     */
    Optional<PullRequest> findForBranch(String owner, String name, String branch);
}
