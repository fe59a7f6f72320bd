package com.agentmanager.core.orchestrator;

import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionRole;
import com.agentmanager.core.state.SessionTrigger;
import com.agentmanager.runner.PullRequest;
import com.agentmanager.runner.PullRequestFinder;
import com.agentmanager.support.InMemoryCore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PullRequestTrackerTest {

    private static final String PR_URL = "https://github.com/acme/widgets/pull/42";

    private InMemoryCore core;
    private PullRequestFinder finder;
    private PullRequestTracker tracker;
    private Repo repo;

    @BeforeEach
    void setUp() {
        core = new InMemoryCore();
        finder = mock(PullRequestFinder.class);
        tracker = new PullRequestTracker(core.repoStore, core.sessionStore, finder);
        repo = core.repo();
    }

    private static Optional<PullRequest> pr(String url) {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        return Optional.of(new PullRequest(42, "Fix the build", "OPEN", url, "agent/widgets/x", "main", false, now, now));
    }

    @Test
    @DisplayName("the PR of an active session's branch is cached on the session")
    void cachesUrl() {
        Session session = core.session(repo, SessionRole.IMPLEMENTER);
        when(finder.findForBranch("acme", "widgets", session.branchName())).thenReturn(pr(PR_URL));

        Session refreshed = tracker.refresh(session);

        assertEquals(PR_URL, refreshed.lastKnownPrUrl());
        assertEquals(PR_URL, core.sessionStore.findById(session.id()).orElseThrow().lastKnownPrUrl());
    }

    @Test
    @DisplayName("a finished session shows the PR without its row being written")
    void terminalSessionNotWritten() {
        Session session = core.session(repo, SessionRole.IMPLEMENTER);
        core.stateMachine.apply(session.id(), SessionTrigger.PROCESS_STARTED);
        core.stateMachine.apply(session.id(), SessionTrigger.RESULT);
        Session finished = core.sessionStore.findById(session.id()).orElseThrow();
        when(finder.findForBranch(anyString(), anyString(), anyString())).thenReturn(pr(PR_URL));

        Session refreshed = tracker.refresh(finished);

        assertEquals(PR_URL, refreshed.lastKnownPrUrl());
        assertEquals(finished.updatedAt(), refreshed.updatedAt());
        assertNull(core.sessionStore.findById(session.id()).orElseThrow().lastKnownPrUrl());
    }

    @Test
    @DisplayName("no PR leaves the session untouched")
    void noPullRequest() {
        Session session = core.session(repo, SessionRole.IMPLEMENTER);
        when(finder.findForBranch(anyString(), anyString(), anyString())).thenReturn(Optional.empty());

        assertSame(session, tracker.refresh(session));
        assertNull(core.sessionStore.findById(session.id()).orElseThrow().lastKnownPrUrl());
    }

    @Test
    @DisplayName("an unchanged PR URL is not written again")
    void unchangedUrl() {
        Session session = core.sessionStore.recordPullRequest(core.session(repo, SessionRole.IMPLEMENTER).id(), PR_URL);
        when(finder.findForBranch(anyString(), anyString(), anyString())).thenReturn(pr(PR_URL));

        assertSame(session, tracker.refresh(session));
    }
}
