package com.agentmanager.core.persistence;

import com.agentmanager.core.errors.ConflictException;
import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.model.NewSession;
import com.agentmanager.core.model.RepoStats;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for session rows.
 */
public interface SessionStore {

    /**
     * Inserts a session in {@link SessionStatus#STARTING}.
     * <p>
     * For orchestrator sessions the insert is the check-and-reserve step: it fails with
     * {@link ConflictException} if the repo already has an orchestrator in an active status,
     * and nothing is persisted.
     */
    Session insert(NewSession session);

    Optional<Session> findById(String id);

    List<Session> findByRepo(String repoId);

    List<Session> findByStatus(SessionStatus status);

    /**
     * Sets {@code status} to {@code next} only if it currently equals {@code expected}.
     * Reaching a terminal status also stamps {@code finishedAt}.
     *
     * @return true if the row was updated
     */
    boolean compareAndSetStatus(String id, SessionStatus expected, SessionStatus next);

    /**
     * Records provisioning results while the session is active. Null arguments leave the
     * corresponding column unchanged. A terminal session is not written.
     *
     * @return the session after the update, or as it stands if it was already terminal
     * @throws NotFoundException if the session does not exist
     */
    Session updateProvisioning(String id, String branchName, String worktreePath, String containerId);

    /**
     * Caches the URL of the pull request opened from the session's branch. Like
     * {@link #updateProvisioning}, a terminal session is not written.
     *
     * @return the session after the update, or as it stands if it was already terminal
     */
    Session recordPullRequest(String id, String prUrl);

    RepoStats statsForRepo(String repoId);
}
