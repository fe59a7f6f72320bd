package com.agentmanager.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GhCliPullRequestFinderTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private static final String TWO_PRS = """
            [{"number":12,"title":"Fix the build","state":"MERGED","url":"https://github.com/acme/widgets/pull/12",
              "headRefName":"agent/widgets/abc","baseRefName":"main","isDraft":false,
              "createdAt":"2026-03-01T10:00:00Z","updatedAt":"2026-03-02T08:30:00Z"},
             {"number":9,"title":"Older attempt","state":"CLOSED","url":"https://github.com/acme/widgets/pull/9",
              "headRefName":"agent/widgets/abc","baseRefName":"main","isDraft":true,
              "createdAt":"2026-02-20T10:00:00Z","updatedAt":"2026-02-21T10:00:00Z"}]
            """;

    @Test
    void returnsFirstListedPullRequest() {
        var runner = new RecordingProcessRunner(0, TWO_PRS);
        var finder = new GhCliPullRequestFinder(runner, objectMapper);

        PullRequest pr = finder.findForBranch("acme", "widgets", "agent/widgets/abc").orElseThrow();

        assertEquals(12, pr.number());
        assertEquals("MERGED", pr.state());
        assertEquals("https://github.com/acme/widgets/pull/12", pr.url());
        assertFalse(pr.draft());
        assertEquals(Instant.parse("2026-03-02T08:30:00Z"), pr.updatedAt());
        assertEquals(List.of("gh", "pr", "list", "--repo", "acme/widgets", "--head", "agent/widgets/abc",
                "--state", "all", "--json", GhCliPullRequestFinder.FIELDS), runner.lastCommand);
    }

    @Test
    void emptyWhenBranchHasNoPullRequest() {
        var finder = new GhCliPullRequestFinder(new RecordingProcessRunner(0, "[]"), objectMapper);
        assertEquals(Optional.empty(), finder.findForBranch("acme", "widgets", "agent/widgets/abc"));
    }

    @Test
    void emptyWhenGhFails() {
        var finder = new GhCliPullRequestFinder(new RecordingProcessRunner(1, ""), objectMapper);
        assertTrue(finder.findForBranch("acme", "widgets", "agent/widgets/abc").isEmpty());
    }

    @Test
    void emptyWhenOutputIsNotJson() {
        var finder = new GhCliPullRequestFinder(new RecordingProcessRunner(0, "no git remotes found"), objectMapper);
        assertTrue(finder.findForBranch("acme", "widgets", "agent/widgets/abc").isEmpty());
    }

    @Test
    void emptyWhenGhCannotRun() {
        var runner = new ProcessRunner(5) {
            @Override
            public Result capture(Path workDir, String... command) {
                throw new IllegalStateException("Command failed to run: gh pr list");
            }
        };
        var finder = new GhCliPullRequestFinder(runner, objectMapper);
        assertTrue(finder.findForBranch("acme", "widgets", "agent/widgets/abc").isEmpty());
    }

    private static class RecordingProcessRunner extends ProcessRunner {

        private final Result result;
        List<String> lastCommand;

        RecordingProcessRunner(int exitCode, String output) {
            super(5);
            this.result = new Result(exitCode, output);
        }

        @Override
        public Result capture(Path workDir, String... command) {
            lastCommand = List.of(command);
            return result;
        }
    }
}
