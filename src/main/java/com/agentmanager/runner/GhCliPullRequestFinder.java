package com.agentmanager.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Looks pull requests up with the host's GitHub CLI ({@code gh pr list}).
 */
public class GhCliPullRequestFinder implements PullRequestFinder {

    private static final Logger log = LoggerFactory.getLogger(GhCliPullRequestFinder.class);

    static final String FIELDS = "number,title,state,url,headRefName,baseRefName,isDraft,createdAt,updatedAt";

    private static final TypeReference<List<PullRequest>> PR_LIST = new TypeReference<>() {};

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;

    public GhCliPullRequestFinder(ProcessRunner processRunner, ObjectMapper objectMapper) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<PullRequest> findForBranch(String owner, String name, String branch) {
        String repo = owner + "/" + name;
        ProcessRunner.Result result;
        try {
            result = processRunner.capture(null, "gh", "pr", "list", "--repo", repo, "--head", branch,
                    "--state", "all", "--json", FIELDS);
        } catch (IllegalStateException e) {
            log.warn("Pull request lookup for {}:{} failed: {}", repo, branch, e.getMessage());
            return Optional.empty();
        }
        if (!result.succeeded()) {
            log.debug("gh pr list for {}:{} exited with code {}", repo, branch, result.exitCode());
            return Optional.empty();
        }
        String output = result.output() == null ? "" : result.output().trim();
        if (output.isEmpty()) {
            return Optional.empty();
        }
        try {
            List<PullRequest> prs = objectMapper.readValue(output, PR_LIST);
            return prs.stream().findFirst();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable gh pr list output for {}:{}: {}", repo, branch, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
