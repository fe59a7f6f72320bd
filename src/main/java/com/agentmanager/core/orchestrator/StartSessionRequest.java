package com.agentmanager.core.orchestrator;

/**
 * Input to {@link SessionOrchestrator#startSession}. Everything except {@code repoId} is optional.
 *
 * @param repoId       repo to work on
 * @param role         "implementer" (default) or "orchestrator"
 * @param baseBranch   branch to cut from; defaults to the repo's default branch
 * @param branchSuffix last segment of the session branch; defaults to the session id prefix
 * @param goalPrompt   initial instruction for the agent
 * @param model        Claude model alias; defaults to the configured model
 */
public record StartSessionRequest(
        String repoId,
        String role,
        String baseBranch,
        String branchSuffix,
        String goalPrompt,
        String model
) {}
