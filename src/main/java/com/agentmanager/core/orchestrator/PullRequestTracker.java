package com.agentmanager.core.orchestrator;

import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.persistence.RepoStore;
import com.agentmanager.core.persistence.SessionStore;
import com.agentmanager.runner.PullRequest;
import com.agentmanager.runner.PullRequestFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Keeps {@code lastKnownPrUrl} in step with the pull request opened from a session's branch.
 * <p>
 * The URL is cached on the row while the session is active. Terminal rows are never written, so
 * for them the URL found is only carried on the returned copy.
 */
@Service
public class PullRequestTracker {

    private static final Logger log = LoggerFactory.getLogger(PullRequestTracker.class);

    private final RepoStore repoStore;
    private final SessionStore sessionStore;
    private final PullRequestFinder finder;

    public PullRequestTracker(RepoStore repoStore, SessionStore sessionStore, PullRequestFinder finder) {
        this.repoStore = repoStore;
        this.sessionStore = sessionStore;
        this.finder = finder;
    }

    public Session refresh(Session session) {
        if (session.branchName() == null) {
            return session;
        }
        Optional<Repo> repo = repoStore.findById(session.repoId());
        if (repo.isEmpty()) {
            return session;
        }
        Optional<String> url = finder.findForBranch(repo.get().owner(), repo.get().name(), session.branchName())
                .map(PullRequest::url);
        if (url.isEmpty() || url.get().equals(session.lastKnownPrUrl())) {
            return session;
        }
        if (session.isTerminal()) {
            return session.withPrUrl(url.get());
        }
        log.info("Session {} has pull request {}", session.id(), url.get());
        Session updated = sessionStore.recordPullRequest(session.id(), url.get());
        // the session may have ended since it was read
        return url.get().equals(updated.lastKnownPrUrl()) ? updated : updated.withPrUrl(url.get());
    }
}
