package com.agentmanager.runner;

import com.agentmanager.core.model.SessionRole;

import java.nio.file.Path;

/**
 * Everything needed to start the sandbox container of one session.
 *
 * @param sessionId      the session the container serves (also its label and name suffix)
 * @param worktreePath   host path of the session worktree, bind-mounted as /workspace
 * @param credential     ephemeral GitHub token handed to the agent as {@code GH_TOKEN}
 * @param gatewayAddress WebSocket URL the agent connects back to
 * @param image          container image
 * @param role           session role
 * @param goalPrompt     initial goal for the agent, may be null
 * @param model          Claude model alias
 * @param systemPrompt   extra system prompt, may be null
 * @param memoryLimitMb  memory limit in MB
 * @param cpuCount       CPU count limit
 */
public record ContainerSpec(
        String sessionId,
        Path worktreePath,
        String credential,
        String gatewayAddress,
        String image,
        SessionRole role,
        String goalPrompt,
        String model,
        String systemPrompt,
        int memoryLimitMb,
        int cpuCount
) {

    @Override
    public String toString() {
        // keeps the credential out of logs
        return "ContainerSpec[sessionId=" + sessionId + ", image=" + image + ", role=" + role.wireName()
                + ", worktreePath=" + worktreePath + "]";
    }
}
