package com.agentmanager.core.orchestrator;

import com.agentmanager.core.errors.ConflictException;
import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.errors.ProvisioningException;
import com.agentmanager.core.errors.ValidationException;
import com.agentmanager.core.events.SessionEventRecorder;
import com.agentmanager.core.logging.MdcContext;
import com.agentmanager.core.metrics.AgentManagerMetrics;
import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.NewSession;
import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionRole;
import com.agentmanager.core.persistence.RepoStore;
import com.agentmanager.core.persistence.SessionStore;
import com.agentmanager.core.state.SessionStateMachine;
import com.agentmanager.core.state.SessionTrigger;
import com.agentmanager.core.state.Transition;
import com.agentmanager.runner.ContainerSpec;
import com.agentmanager.runner.ContainerSupervisor;
import com.agentmanager.runner.CredentialBroker;
import com.agentmanager.runner.RunnerProperties;
import com.agentmanager.runner.WorktreeInfo;
import com.agentmanager.runner.WorktreeProvisioner;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Creates, provisions and terminates agent sessions.
 *
 * <p>Provisioning is a fixed pipeline: reserve the session row, create the worktree, obtain
 * a credential, start the container, announce {@code session.started}. Every step waits for
 * the previous one. A failing step moves the session to {@code error}, logs a
 * {@code session.error} event with {@code phase=startup} and the failing step, and releases
 * whatever was already acquired before the failure is reported to the caller.
 *
 * <p>Stop and abort wait a bounded time for the container to go away, then force-kill it
 * and mark the session {@code error} with {@code phase=shutdown-timeout}.
 */
@Service
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final RepoStore repoStore;
    private final SessionStore sessionStore;
    private final SessionStateMachine stateMachine;
    private final SessionEventRecorder recorder;
    private final WorktreeProvisioner worktreeProvisioner;
    private final CredentialBroker credentialBroker;
    private final ContainerSupervisor containerSupervisor;
    private final RunnerProperties properties;
    private final AgentManagerMetrics metrics;
    private final Clock clock;
    private final ExecutorService containerExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "container-ops");
        t.setDaemon(true);
        return t;
    });

    public SessionOrchestrator(RepoStore repoStore,
                               SessionStore sessionStore,
                               SessionStateMachine stateMachine,
                               SessionEventRecorder recorder,
                               WorktreeProvisioner worktreeProvisioner,
                               CredentialBroker credentialBroker,
                               ContainerSupervisor containerSupervisor,
                               RunnerProperties properties,
                               AgentManagerMetrics metrics,
                               Clock clock) {
        this.repoStore = repoStore;
        this.sessionStore = sessionStore;
        this.stateMachine = stateMachine;
        this.recorder = recorder;
        this.worktreeProvisioner = worktreeProvisioner;
        this.credentialBroker = credentialBroker;
        this.containerSupervisor = containerSupervisor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PreDestroy
    void shutdown() {
        containerExecutor.shutdownNow();
    }

    /**
     * Starts a session and runs the provisioning pipeline to completion.
     *
     * @return the session as it stands after provisioning, normally still {@code starting}
     *         until the agent reports {@code process.started}
     * @throws ValidationException   for an unknown role or missing repo id
     * @throws NotFoundException     if the repo does not exist
     * @throws ConflictException     if an orchestrator is already active for the repo
     * @throws ProvisioningException if a pipeline step failed; the session is then in {@code error}
     */
    public Session startSession(StartSessionRequest request) {
        if (request.repoId() == null || request.repoId().isBlank()) {
            throw new ValidationException("repoId is required");
        }
        SessionRole role = request.role() == null || request.role().isBlank()
                ? SessionRole.IMPLEMENTER
                : SessionRole.parse(request.role()).orElseThrow(() -> new ValidationException(
                        "Invalid role '" + request.role() + "': must be 'implementer' or 'orchestrator'"));
        Repo repo = repoStore.findById(request.repoId())
                .orElseThrow(() -> new NotFoundException("Repo", request.repoId()));

        String sessionId = UUID.randomUUID().toString();
        String baseBranch = valueOrDefault(request.baseBranch(), repo.defaultBranch());
        String branchName = BranchNames.forSession(repo.name(), request.branchSuffix(), sessionId);
        String model = valueOrDefault(request.model(), properties.getDefaultModel());

        Session session;
        try {
            session = sessionStore.insert(new NewSession(sessionId, repo.id(), role, branchName, baseBranch,
                    request.goalPrompt(), model, clock.instant()));
        } catch (ConflictException e) {
            metrics.recordOrchestratorConflict();
            log.warn("Rejected orchestrator start for {}: one is already active", repo.fullName());
            throw e;
        }

        MdcContext.setSession(sessionId, repo.id());
        MdcContext.setPhase("startup");
        long startedAt = System.currentTimeMillis();
        try {
            log.info("Provisioning {} session {} for {} on {}", role.wireName(), sessionId, repo.fullName(), branchName);
            Session provisioned = provision(session, repo);
            metrics.recordProvisioning(role, true, System.currentTimeMillis() - startedAt);
            return provisioned;
        } catch (ProvisioningException e) {
            metrics.recordProvisioning(role, false, System.currentTimeMillis() - startedAt);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private Session provision(Session session, Repo repo) {
        ProvisioningStep step = ProvisioningStep.WORKTREE;
        String containerId = null;
        try {
            WorktreeInfo worktree = worktreeProvisioner.createWorktree(
                    repo.owner(), repo.name(), session.id(), session.baseBranch(), session.branchName());
            Session afterWorktree = sessionStore.updateProvisioning(session.id(), worktree.branchName(),
                    worktree.worktreePath().toString(), null);
            if (afterWorktree.isTerminal()) {
                log.info("Session {} became {} during provisioning, skipping its container",
                        session.id(), afterWorktree.status().wireName());
                return afterWorktree;
            }

            step = ProvisioningStep.CREDENTIAL;
            String credential = credentialBroker.issueToken(session.id());

            step = ProvisioningStep.CONTAINER;
            containerId = containerSupervisor.startContainer(new ContainerSpec(
                    session.id(),
                    worktree.worktreePath(),
                    credential,
                    properties.getGatewayUrl(),
                    properties.getContainerImage(),
                    session.role(),
                    session.goalPrompt(),
                    session.model(),
                    SystemPrompts.forRole(session.role(), properties.getBaseSystemPrompt()),
                    properties.getMemoryLimitMb(),
                    properties.getCpuCount()));
            Session current = sessionStore.updateProvisioning(session.id(), null, null, containerId);

            step = ProvisioningStep.FINALIZE;
            if (current.isTerminal()) {
                // stopped or reconciled while the container was starting; the row keeps no container id
                log.info("Session {} became {} during provisioning, releasing its container",
                        session.id(), current.status().wireName());
                killQuietly(containerId);
                return current;
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("role", session.role().wireName());
            payload.put("branchName", worktree.branchName());
            payload.put("baseBranch", session.baseBranch());
            payload.put("containerId", containerId);
            payload.put("goalPrompt", session.goalPrompt());
            payload.put("model", session.model());
            recorder.record(session.id(), EventSource.MANAGER, "session.started", payload);
            repoStore.touchActivity(repo.id());

            log.info("Session {} provisioned (container {})", session.id(), containerId);
            return sessionStore.findById(session.id()).orElse(current);
        } catch (RuntimeException e) {
            failProvisioning(session, step, containerId, e);
            throw new ProvisioningException(session.id(), step.wireName(), e);
        }
    }

    private void failProvisioning(Session session, ProvisioningStep step, String containerId, RuntimeException cause) {
        log.error("Provisioning of session {} failed at step {}: {}", session.id(), step.wireName(),
                cause.getMessage(), cause);
        metrics.recordProvisioningFailure(step.wireName());
        try {
            failSession(session.id(), "startup", Map.of("step", step.wireName(), "error", describe(cause)));
        } catch (RuntimeException e) {
            log.error("Could not record provisioning failure of session {}", session.id(), e);
        }
        if (containerId != null) {
            killQuietly(containerId);
        }
        destroyWorktreeQuietly(session.id());
    }

    /**
     * Stops a session gracefully. A session that is already terminal is left untouched.
     *
     * @throws NotFoundException if the session does not exist
     */
    public Session stopSession(String sessionId) {
        return terminate(sessionId, Termination.STOP);
    }

    /**
     * Aborts a session. Same as {@link #stopSession} except for the event it logs.
     */
    public Session abortSession(String sessionId) {
        return terminate(sessionId, Termination.ABORT);
    }

    private Session terminate(String sessionId, Termination mode) {
        Session session = sessionStore.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Session", sessionId));
        if (session.isTerminal()) {
            log.debug("Session {} is already {}, ignoring {}", sessionId, session.status().wireName(), mode);
            return session;
        }

        MdcContext.setSession(sessionId, session.repoId());
        MdcContext.setPhase("shutdown");
        try {
            if (session.containerId() != null) {
                Optional<String> failure = stopWithinTimeout(session.containerId());
                if (failure.isPresent()) {
                    metrics.recordShutdownTimeout();
                    killQuietly(session.containerId());
                    failSession(sessionId, "shutdown-timeout", Map.of(
                            "containerId", session.containerId(),
                            "error", failure.get()));
                    return reload(sessionId);
                }
            }

            Optional<Transition> transition = stateMachine.applyIfActive(sessionId, SessionTrigger.STOP);
            if (transition.isPresent() && transition.get().changed()) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("stoppedBy", "user");
                payload.put("method", mode.method);
                recorder.record(sessionId, EventSource.MANAGER, mode.eventType, payload);
                log.info("Session {} {}", sessionId, mode == Termination.ABORT ? "aborted" : "stopped");
            }
            return reload(sessionId);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * @return empty when the container went away in time, otherwise why it did not
     */
    private Optional<String> stopWithinTimeout(String containerId) {
        int timeoutSeconds = properties.getStopTimeoutSeconds();
        Future<?> stop = containerExecutor.submit(() -> containerSupervisor.stopContainer(containerId));
        try {
            stop.get(timeoutSeconds, TimeUnit.SECONDS);
            return Optional.empty();
        } catch (TimeoutException e) {
            stop.cancel(true);
            log.warn("Container {} did not stop within {}s, force-killing", containerId, timeoutSeconds);
            return Optional.of("Container did not stop within " + timeoutSeconds + "s");
        } catch (ExecutionException e) {
            log.warn("Stopping container {} failed, force-killing: {}", containerId, e.getCause().getMessage());
            return Optional.of("Container stop failed: " + describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop.cancel(true);
            return Optional.of("Interrupted while stopping container");
        }
    }

    /**
     * Best-effort removal of a session's container, off the calling thread.
     * Used when a session is failed by someone other than the orchestrator (heartbeat loss).
     */
    public void releaseContainer(String sessionId) {
        sessionStore.findById(sessionId)
                .map(Session::containerId)
                .ifPresent(containerId -> containerExecutor.execute(() -> killQuietly(containerId)));
    }

    /**
     * Fails a session stuck in provisioning and releases its resources. No-op if it already left {@code starting}.
     */
    void failStuckSession(Session session, String reason) {
        MdcContext.setSession(session.id(), session.repoId());
        MdcContext.setPhase("reconcile");
        try {
            boolean failed = failSession(session.id(), "reconcile", Map.of("error", reason));
            if (!failed) {
                return;
            }
            log.warn("Session {} failed by reconciliation: {}", session.id(), reason);
            Session current = reload(session.id());
            if (current.containerId() != null) {
                killQuietly(current.containerId());
            }
            destroyWorktreeQuietly(session.id());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Moves the session to {@code error} and logs the matching {@code session.error} event,
     * tagged with {@code phase}.
     *
     * @return false if the session was already terminal, in which case nothing is logged
     */
    public boolean failSession(String sessionId, String phase, Map<String, Object> detail) {
        Optional<Transition> transition = stateMachine.applyIfActive(sessionId, SessionTrigger.FAILURE);
        if (transition.isEmpty() || !transition.get().changed()) {
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phase", phase);
        payload.putAll(detail);
        recorder.record(sessionId, EventSource.MANAGER, "session.error", payload);
        return true;
    }

    private Session reload(String sessionId) {
        return sessionStore.findById(sessionId).orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    private void killQuietly(String containerId) {
        try {
            containerSupervisor.killContainer(containerId);
        } catch (Exception e) {
            log.warn("Failed to remove container {}: {}", containerId, e.getMessage());
        }
    }

    private void destroyWorktreeQuietly(String sessionId) {
        try {
            worktreeProvisioner.destroyWorktree(sessionId);
        } catch (Exception e) {
            log.warn("Failed to remove worktree of session {}: {}", sessionId, e.getMessage());
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static String valueOrDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private enum Termination {
        STOP("session.stopped", "stop"),
        ABORT("session.aborted", "abort");

        private final String eventType;
        private final String method;

        Termination(String eventType, String method) {
            this.eventType = eventType;
            this.method = method;
        }
    }
}
