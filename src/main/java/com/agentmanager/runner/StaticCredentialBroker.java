package com.agentmanager.runner;

/**
 * Hands every session the token configured in {@code agentmanager.github.token}.
 */
public class StaticCredentialBroker implements CredentialBroker {

    private final String token;

    public StaticCredentialBroker(String token) {
        this.token = token;
    }

    @Override
    public String issueToken(String sessionId) {
        return token;
    }
}
