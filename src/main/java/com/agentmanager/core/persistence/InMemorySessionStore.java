package com.agentmanager.core.persistence;

import com.agentmanager.core.errors.ConflictException;
import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.model.NewSession;
import com.agentmanager.core.model.RepoStats;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionRole;
import com.agentmanager.core.model.SessionStatus;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link SessionStore} kept in a map. Used when no database is configured and in tests.
 * <p>
 * Every write runs under the store's monitor, so a status change and a provisioning update
 * on the same session cannot overwrite each other.
 */
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Session insert(NewSession newSession) {
        if (newSession.role() == SessionRole.ORCHESTRATOR) {
            boolean active = sessions.values().stream()
                    .anyMatch(s -> s.repoId().equals(newSession.repoId())
                            && s.role() == SessionRole.ORCHESTRATOR
                            && s.status().isActive());
            if (active) {
                throw new ConflictException(newSession.repoId());
            }
        }
        Session session = newSession.toSession();
        sessions.put(session.id(), session);
        return session;
    }

    @Override
    public Optional<Session> findById(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    @Override
    public List<Session> findByRepo(String repoId) {
        return sessions.values().stream()
                .filter(s -> s.repoId().equals(repoId))
                .sorted(Comparator.comparing(Session::createdAt).reversed())
                .toList();
    }

    @Override
    public List<Session> findByStatus(SessionStatus status) {
        return sessions.values().stream()
                .filter(s -> s.status() == status)
                .sorted(Comparator.comparing(Session::createdAt))
                .toList();
    }

    @Override
    public synchronized boolean compareAndSetStatus(String id, SessionStatus expected, SessionStatus next) {
        Session current = sessions.get(id);
        if (current == null || current.status() != expected) {
            return false;
        }
        sessions.put(id, current.withStatus(next, clock.instant()));
        return true;
    }

    @Override
    public synchronized Session updateProvisioning(String id, String branchName, String worktreePath, String containerId) {
        return updateIfActive(id, s -> s.withProvisioning(branchName, worktreePath, containerId, clock.instant()));
    }

    @Override
    public synchronized Session recordPullRequest(String id, String prUrl) {
        return updateIfActive(id, s -> s.withPrUrl(prUrl));
    }

    // callers hold the store's monitor, shared with insert and compareAndSetStatus
    private Session updateIfActive(String id, UnaryOperator<Session> update) {
        Session current = sessions.get(id);
        if (current == null) {
            throw new NotFoundException("Session", id);
        }
        if (current.isTerminal()) {
            return current;
        }
        Session updated = update.apply(current);
        sessions.put(id, updated);
        return updated;
    }

    @Override
    public RepoStats statsForRepo(String repoId) {
        List<Session> repoSessions = findByRepo(repoId);
        int active = (int) repoSessions.stream().filter(s -> s.status().isActive()).count();
        return new RepoStats(
                repoSessions.size(),
                active,
                repoSessions.stream().anyMatch(s -> s.status() == SessionStatus.RUNNING),
                repoSessions.stream().anyMatch(s -> s.status() == SessionStatus.WAITING),
                repoSessions.stream().anyMatch(s -> s.status() == SessionStatus.ERROR));
    }
}
