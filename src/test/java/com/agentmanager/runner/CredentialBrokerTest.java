package com.agentmanager.runner;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CredentialBrokerTest {

    @Test
    void staticBrokerHandsOutConfiguredToken() {
        assertEquals("ghp_configured", new StaticCredentialBroker("ghp_configured").issueToken("sess-1"));
    }

    @Test
    void ghCliBrokerTrimsTokenOutput() {
        var broker = new GhCliCredentialBroker(new FixedProcessRunner(0, "gho_token\n"));
        assertEquals("gho_token", broker.issueToken("sess-1"));
    }

    @Test
    void ghCliBrokerFailsWhenNotLoggedIn() {
        var broker = new GhCliCredentialBroker(new FixedProcessRunner(1, ""));
        var e = assertThrows(IllegalStateException.class, () -> broker.issueToken("sess-1"));
        assertTrue(e.getMessage().contains("gh auth login"));
    }

    @Test
    void ghCliBrokerRejectsEmptyToken() {
        var broker = new GhCliCredentialBroker(new FixedProcessRunner(0, "   "));
        assertThrows(IllegalStateException.class, () -> broker.issueToken("sess-1"));
    }

    private static class FixedProcessRunner extends ProcessRunner {

        private final Result result;

        FixedProcessRunner(int exitCode, String output) {
            super(5);
            this.result = new Result(exitCode, output);
        }

        @Override
        public Result capture(Path workDir, String... command) {
            return result;
        }
    }
}
