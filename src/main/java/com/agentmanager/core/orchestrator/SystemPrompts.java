package com.agentmanager.core.orchestrator;

import com.agentmanager.core.model.SessionRole;

/**
 * Builds the system prompt handed to the agent process, by role.
 * A configured base prompt replaces the built-in one; the role section is always appended.
 */
final class SystemPrompts {

    private static final String DEFAULT_BASE = """
            You are a coding agent running in an isolated container.
            Your working copy is /workspace, a git worktree checked out on a branch created for this session.

            - Anything inside /workspace is yours to read and change, and you may run any command you need.
            - Commit in small steps with descriptive messages and push the branch when a piece of work is ready for review.
            - When a task is done, or you need a decision from the user, stop and wait for the next message.
            """;

    private static final String IMPLEMENTER = """

            Role: implementer.
            - Make the code changes the task calls for.
            - Follow the repository's own conventions; read CLAUDE.md first if it exists.
            - Run the tests before you push.
            """;

    private static final String ORCHESTRATOR = """

            Role: orchestrator.
            - You plan work for the repository and split it into tasks other agent sessions can pick up.
            - Keep track of what the other sessions report and propose how to sequence their work.
            """;

    private SystemPrompts() {}

    static String forRole(SessionRole role, String configuredBase) {
        String base = configuredBase != null && !configuredBase.isBlank() ? configuredBase : DEFAULT_BASE;
        return base + (role == SessionRole.ORCHESTRATOR ? ORCHESTRATOR : IMPLEMENTER);
    }
}
