package com.agentmanager.runner;

/**
 * Supplies the GitHub token a session's agent uses for git and {@code gh}.
 */
public interface CredentialBroker {

    /**
     * Returns a token for {@code sessionId}. Never logged.
     *
     * @throws IllegalStateException if no token can be obtained
     */
    String issueToken(String sessionId);
}
