package com.agentmanager.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains tokens from the host's GitHub CLI login ({@code gh auth token}).
 */
public class GhCliCredentialBroker implements CredentialBroker {

    private static final Logger log = LoggerFactory.getLogger(GhCliCredentialBroker.class);

    private final ProcessRunner processRunner;

    public GhCliCredentialBroker(ProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    @Override
    public String issueToken(String sessionId) {
        var result = processRunner.capture(null, "gh", "auth", "token");
        String token = result.output() == null ? "" : result.output().trim();
        if (!result.succeeded() || token.isEmpty()) {
            throw new IllegalStateException(
                    "Could not obtain a GitHub token (gh exit code " + result.exitCode() + "); run 'gh auth login'");
        }
        log.debug("Issued GitHub token for session {}", sessionId);
        return token;
    }
}
