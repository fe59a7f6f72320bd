package com.agentmanager.gateway;

import com.agentmanager.core.errors.AgentManagerException;
import com.agentmanager.core.errors.LivenessException;
import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.errors.ProtocolException;
import com.agentmanager.core.events.EventBus;
import com.agentmanager.core.events.SessionEventRecorder;
import com.agentmanager.core.logging.MdcContext;
import com.agentmanager.core.metrics.AgentManagerMetrics;
import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.core.model.SessionStatus;
import com.agentmanager.core.orchestrator.SessionOrchestrator;
import com.agentmanager.core.persistence.RepoStore;
import com.agentmanager.core.persistence.SessionStore;
import com.agentmanager.core.state.SessionStateMachine;
import com.agentmanager.core.state.SessionTrigger;
import com.agentmanager.gateway.EnvelopePayload.Ack;
import com.agentmanager.gateway.EnvelopePayload.AgentEvent;
import com.agentmanager.gateway.EnvelopePayload.ClaudeMessage;
import com.agentmanager.gateway.EnvelopePayload.Command;
import com.agentmanager.gateway.EnvelopePayload.ErrorReply;
import com.agentmanager.gateway.EnvelopePayload.LoggedEvent;
import com.agentmanager.gateway.EnvelopePayload.RepoActivity;
import com.agentmanager.gateway.EnvelopePayload.RepoListSnapshot;
import com.agentmanager.gateway.EnvelopePayload.RepoSnapshot;
import com.agentmanager.gateway.EnvelopePayload.RunnerEvent;
import com.agentmanager.gateway.EnvelopePayload.SessionUpdated;
import com.agentmanager.gateway.EnvelopePayload.Snapshot;
import com.agentmanager.gateway.EnvelopePayload.Subscribe;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Multiplexes traffic between the agent connection of each session and the clients watching it.
 * <p>
 * Inbound frames are validated by {@link EnvelopeCodec}; an invalid frame is answered with an
 * {@code error} frame on the same connection and changes nothing else. Agent events are logged,
 * fanned out to subscribers through the log, and fed to the {@link SessionStateMachine}.
 * Client commands are logged and relayed to the agent. {@code ack} and {@code error} frames are
 * protocol traffic and are never logged.
 * <p>
 * Inbound seqs must increase per connection and session; a frame whose seq does not is answered
 * with {@code OUT_OF_ORDER} and dropped.
 * <p>
 * Besides single sessions, clients may subscribe to the repo list and to one repo. Those
 * subscriptions get a snapshot up front and then {@code repo.activity} or {@code session.updated}
 * events whenever a session of the repo starts or changes status.
 * <p>
 * Outbound {@code event} and {@code command} frames carry the seq the log assigned.
 * {@code ack}, {@code error} and {@code snapshot} frames carry a per-connection counter.
 * <p>
 * Liveness: an active session is tracked from {@code session.started} on. Each heartbeat refreshes it;
 * after {@code missedHeartbeatLimit} silent intervals the session is failed with
 * {@code phase=liveness}, its agent connection closed and its container released.
 */
@Service
public class SessionGateway {

    private static final Logger log = LoggerFactory.getLogger(SessionGateway.class);

    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final EnvelopeCodec codec;
    private final SessionEventRecorder recorder;
    private final RepoStore repoStore;
    private final SessionStore sessionStore;
    private final SessionStateMachine stateMachine;
    private final SessionOrchestrator orchestrator;
    private final AgentManagerMetrics metrics;
    private final Clock clock;
    private final Executor commandExecutor;
    private final LivenessTracker liveness;
    private final long heartbeatIntervalMs;

    private final ConcurrentHashMap<String, ConnectionState> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConnectionState> agents = new ConcurrentHashMap<>();

    private final ScheduledExecutorService livenessScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "gateway-liveness");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SessionGateway(EnvelopeCodec codec,
                          SessionEventRecorder recorder,
                          EventBus eventBus,
                          RepoStore repoStore,
                          SessionStore sessionStore,
                          SessionStateMachine stateMachine,
                          SessionOrchestrator orchestrator,
                          GatewayProperties properties,
                          AgentManagerMetrics metrics,
                          Clock clock) {
        this(codec, recorder, eventBus, repoStore, sessionStore, stateMachine, orchestrator, properties, metrics,
                clock, newCommandExecutor());
    }

    SessionGateway(EnvelopeCodec codec,
                   SessionEventRecorder recorder,
                   EventBus eventBus,
                   RepoStore repoStore,
                   SessionStore sessionStore,
                   SessionStateMachine stateMachine,
                   SessionOrchestrator orchestrator,
                   GatewayProperties properties,
                   AgentManagerMetrics metrics,
                   Clock clock,
                   Executor commandExecutor) {
        this.codec = codec;
        this.recorder = recorder;
        this.repoStore = repoStore;
        this.sessionStore = sessionStore;
        this.stateMachine = stateMachine;
        this.orchestrator = orchestrator;
        this.metrics = metrics;
        this.clock = clock;
        this.commandExecutor = commandExecutor;
        this.heartbeatIntervalMs = properties.getHeartbeatIntervalMs();
        this.liveness = new LivenessTracker(Duration.ofMillis(heartbeatIntervalMs),
                properties.getMissedHeartbeatLimit());
        eventBus.subscribeAll(this::onLifecycleEvent);
    }

    private static ExecutorService newCommandExecutor() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gateway-commands");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    void startLivenessChecks() {
        long period = Math.max(heartbeatIntervalMs / 2, 100);
        livenessScheduler.scheduleAtFixedRate(this::checkLivenessSafely, period, period, TimeUnit.MILLISECONDS);
        log.info("Gateway liveness checks started (heartbeat interval={}ms)", heartbeatIntervalMs);
    }

    @PreDestroy
    void stopLivenessChecks() {
        livenessScheduler.shutdownNow();
        if (commandExecutor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }

    // -- connection lifecycle --

    public void onOpen(GatewayConnection connection) {
        ConnectionState state = new ConnectionState(connection);
        connections.put(connection.id(), state);
        log.debug("Connection {} opened", connection.id());
        sendControl(state, EnvelopeKind.ACK, null,
                new Ack(0, true, Map.of("type", "connected", "connectionId", connection.id())));
    }

    public void onClose(String connectionId) {
        ConnectionState state = connections.remove(connectionId);
        if (state == null) {
            return;
        }
        state.subscriptions.values().forEach(EventBus.Subscription::unsubscribe);
        state.subscriptions.clear();
        String agentSession = state.agentSessionId;
        if (agentSession != null && agents.remove(agentSession, state)) {
            // liveness decides what a lost agent means for the session
            log.info("Agent connection for session {} closed", agentSession);
        } else {
            log.debug("Connection {} closed", connectionId);
        }
    }

    public void onFrame(String connectionId, String text) {
        ConnectionState state = connections.get(connectionId);
        if (state == null) {
            log.debug("Dropping frame for unknown connection {}", connectionId);
            return;
        }
        Envelope envelope = null;
        try {
            envelope = codec.decode(text);
            if (envelope.sessionId() != null) {
                MdcContext.setSession(envelope.sessionId());
            }
            state.acceptSeq(envelope);
            dispatch(state, envelope);
        } catch (AgentManagerException e) {
            String code = e instanceof NotFoundException ? ProtocolException.UNKNOWN_SESSION : e.code();
            metrics.recordProtocolError(code);
            log.debug("Rejected frame on connection {}: {} {}", connectionId, code, e.getMessage());
            sendError(state, envelope, code, e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordProtocolError(INTERNAL_ERROR);
            log.error("Failed to handle frame on connection {}", connectionId, e);
            sendError(state, envelope, INTERNAL_ERROR, "Internal error");
        } finally {
            MdcContext.clear();
        }
    }

    private void dispatch(ConnectionState state, Envelope envelope) {
        switch (envelope.kind()) {
            case EVENT -> handleAgentEvent(state, envelope, (AgentEvent) envelope.payload());
            case COMMAND -> handleCommand(state, envelope, (Command) envelope.payload());
            case SUBSCRIBE -> handleSubscribe(state, envelope, (Subscribe) envelope.payload());
            case ACK -> log.debug("Ack from {} for seq {}", state.connection.id(),
                    ((Ack) envelope.payload()).commandSeq());
            case ERROR -> {
                ErrorReply error = (ErrorReply) envelope.payload();
                log.warn("Peer {} reported error {}: {}", state.connection.id(), error.code(), error.message());
            }
            case SNAPSHOT -> throw new ProtocolException(ProtocolException.UNSUPPORTED_DIRECTION,
                    "snapshot frames are only sent by the server");
        }
    }

    // -- agent side --

    private void handleAgentEvent(ConnectionState state, Envelope envelope, AgentEvent event) {
        Session session = requireSession(envelope);
        bindAgent(state, session.id());

        String type;
        Map<String, Object> payload;
        if (event instanceof ClaudeMessage claude) {
            type = "claude." + claude.messageType();
            payload = claude.message();
        } else {
            RunnerEvent runner = (RunnerEvent) event;
            type = runner.type().wireName();
            payload = runner.data();
        }
        SessionEvent logged = recorder.record(session.id(), EventSource.AGENT, type, payload);

        if (event instanceof RunnerEvent runner) {
            applyRunnerEvent(session.id(), runner);
        } else if ("assistant".equals(((ClaudeMessage) event).messageType())) {
            stateMachine.applyIfActive(session.id(), SessionTrigger.RESUMED);
        }

        sendControl(state, EnvelopeKind.ACK, session.id(),
                new Ack(envelope.seq(), true, Map.of("eventSeq", logged.seq())));
    }

    private void applyRunnerEvent(String sessionId, RunnerEvent runner) {
        switch (runner.type()) {
            case HEARTBEAT -> trackIfActive(sessionId);
            case PROCESS_STARTED -> {
                trackIfActive(sessionId);
                stateMachine.applyIfActive(sessionId, SessionTrigger.PROCESS_STARTED);
            }
            case SESSION_IDLE -> stateMachine.applyIfActive(sessionId, SessionTrigger.IDLE);
            case SESSION_RESULT -> {
                if (isCleanResult(runner.data())) {
                    stateMachine.applyIfActive(sessionId, SessionTrigger.RESULT);
                } else {
                    orchestrator.failSession(sessionId, "agent-result", detail("error", "Agent reported an unsuccessful result"));
                }
            }
            case PROCESS_ERROR -> orchestrator.failSession(sessionId, "process",
                    detail("error", runner.data().getOrDefault("message", runner.data().get("error"))));
            case PROCESS_EXITED -> {
                Object reason = runner.data().get("reason");
                if ("sigterm".equals(reason) || "sigint".equals(reason)) {
                    log.info("Agent of session {} exited on {}", sessionId, reason);
                } else {
                    Map<String, Object> detail = new LinkedHashMap<>();
                    detail.put("exitCode", runner.data().get("exitCode"));
                    detail.put("signal", runner.data().get("signal"));
                    detail.put("reason", reason);
                    orchestrator.failSession(sessionId, "process-exit", detail);
                }
            }
            case PROCESS_STDOUT, PROCESS_STDERR, SESSION_TURN_COMPLETE -> {
                // logged only
            }
        }
    }

    /**
     * A result is clean unless it says otherwise, either at the top level or in a nested {@code result}.
     */
    static boolean isCleanResult(Map<String, Object> data) {
        if (failedResult(data)) {
            return false;
        }
        Object nested = data.get("result");
        return !(nested instanceof Map<?, ?> map && failedResult(map));
    }

    private static boolean failedResult(Map<?, ?> data) {
        Object subtype = data.get("subtype");
        return Boolean.TRUE.equals(data.get("is_error"))
                || Boolean.TRUE.equals(data.get("isError"))
                || (subtype instanceof String s && !"success".equals(s));
    }

    private void bindAgent(ConnectionState state, String sessionId) {
        if (state.agentSessionId != null) {
            if (!state.agentSessionId.equals(sessionId)) {
                throw new ProtocolException(ProtocolException.INVALID_MESSAGE,
                        "Connection is bound to session " + state.agentSessionId);
            }
            return;
        }
        state.agentSessionId = sessionId;
        ConnectionState previous = agents.put(sessionId, state);
        if (previous != null && previous != state) {
            log.warn("Replacing agent connection {} for session {}", previous.connection.id(), sessionId);
            previous.agentSessionId = null;
            previous.connection.close("Replaced by a newer agent connection");
        }
        log.info("Agent connected for session {} on connection {}", sessionId, state.connection.id());
    }

    // -- client side --

    private void handleCommand(ConnectionState state, Envelope envelope, Command command) {
        if (command.type() == CommandType.UNSUBSCRIBE) {
            EventBus.Subscription removed = state.subscriptions.remove(command.subscriptionId());
            if (removed != null) {
                removed.unsubscribe();
            }
            log.debug("Connection {} unsubscribed from {}", state.connection.id(), command.subscriptionId());
            sendControl(state, EnvelopeKind.ACK, envelope.sessionId(), new Ack(envelope.seq(), true,
                    Map.of("subscriptionId", command.subscriptionId(), "removed", removed != null)));
            return;
        }
        Session session = requireSession(envelope);
        String sessionId = session.id();

        switch (command.type()) {
            case USER_MESSAGE -> {
                SessionEvent logged = sendUserMessage(session, command.message(), command.force());
                sendControl(state, EnvelopeKind.ACK, sessionId,
                        new Ack(envelope.seq(), true, Map.of("eventSeq", logged.seq())));
            }
            case STOP, ABORT -> {
                if (session.isTerminal()) {
                    sendControl(state, EnvelopeKind.ACK, sessionId,
                            new Ack(envelope.seq(), true, Map.of("noop", true, "status", session.status().wireName())));
                    return;
                }
                SessionEvent logged = recorder.record(sessionId, EventSource.USER, "user." + command.type().wireName(), Map.of());
                ConnectionState agent = agents.get(sessionId);
                if (agent != null) {
                    relayToAgent(agent, sessionId, logged.seq(), command);
                }
                boolean abort = command.type() == CommandType.ABORT;
                commandExecutor.execute(() -> terminate(sessionId, abort));
                sendControl(state, EnvelopeKind.ACK, sessionId,
                        new Ack(envelope.seq(), true, Map.of("eventSeq", logged.seq())));
            }
            case UNSUBSCRIBE -> throw new IllegalStateException("unsubscribe is handled above");
        }
    }

    /**
     * Logs a user message and relays it to the session's agent.
     *
     * @param force deliver even though the session is not waiting for input
     * @return the logged {@code user.message} event
     * @throws ProtocolException {@code UNKNOWN_SESSION}, {@code SESSION_NOT_WAITING} or {@code NO_AGENT}
     */
    public SessionEvent sendUserMessage(String sessionId, String message, boolean force) {
        Session session = sessionStore.findById(sessionId)
                .orElseThrow(() -> new ProtocolException(ProtocolException.UNKNOWN_SESSION,
                        "Unknown session: " + sessionId));
        return sendUserMessage(session, message, force);
    }

    private SessionEvent sendUserMessage(Session session, String message, boolean force) {
        String sessionId = session.id();
        if (session.isTerminal()) {
            throw new ProtocolException(ProtocolException.SESSION_NOT_WAITING,
                    "Session is " + session.status().wireName());
        }
        ConnectionState agent = agents.get(sessionId);
        if (agent == null || !agent.connection.isOpen()) {
            throw new ProtocolException(ProtocolException.NO_AGENT, "No agent connected for session " + sessionId);
        }
        if (!force && session.status() != SessionStatus.WAITING) {
            throw new ProtocolException(ProtocolException.SESSION_NOT_WAITING,
                    "Session is " + session.status().wireName() + ", not waiting for input");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        if (force) {
            payload.put("force", true);
        }
        SessionEvent logged = recorder.record(sessionId, EventSource.USER, "user.message", payload);
        relayToAgent(agent, sessionId, logged.seq(), Command.of(CommandType.USER_MESSAGE, message, force));
        stateMachine.applyIfActive(sessionId, SessionTrigger.RESUMED);
        return logged;
    }

    private void terminate(String sessionId, boolean abort) {
        try {
            if (abort) {
                orchestrator.abortSession(sessionId);
            } else {
                orchestrator.stopSession(sessionId);
            }
        } catch (Exception e) {
            log.error("Failed to {} session {}", abort ? "abort" : "stop", sessionId, e);
        }
    }

    private void relayToAgent(ConnectionState agent, String sessionId, long seq, Command command) {
        Envelope out = Envelope.of(EnvelopeKind.COMMAND, sessionId, seq, command, clock.instant());
        if (!send(agent, out)) {
            throw new ProtocolException(ProtocolException.NO_AGENT, "Agent connection for session " + sessionId + " is gone");
        }
    }

    private void handleSubscribe(ConnectionState state, Envelope envelope, Subscribe subscribe) {
        switch (subscribe.target()) {
            case SESSION -> subscribeToSession(state, envelope, subscribe.sinceSeq());
            case REPO_LIST -> {
                List<RepoSummary> repos = repoStore.findAll().stream().map(this::summarize).toList();
                replaceSubscription(state, SubscribeTarget.REPO_LIST_SUBSCRIPTION, () -> {});
                sendControl(state, EnvelopeKind.SNAPSHOT, null, new RepoListSnapshot(repos));
                log.debug("Connection {} subscribed to the repo list", state.connection.id());
            }
            case REPO -> {
                Repo repo = repoStore.findById(subscribe.repoId())
                        .orElseThrow(() -> new ProtocolException(ProtocolException.UNKNOWN_REPO,
                                "Unknown repo: " + subscribe.repoId()));
                replaceSubscription(state, SubscribeTarget.repoSubscription(repo.id()), () -> {});
                sendControl(state, EnvelopeKind.SNAPSHOT, null,
                        new RepoSnapshot(summarize(repo), sessionStore.findByRepo(repo.id())));
                log.debug("Connection {} subscribed to repo {}", state.connection.id(), repo.fullName());
            }
        }
    }

    private void subscribeToSession(ConnectionState state, Envelope envelope, long sinceSeq) {
        String sessionId = requireSession(envelope).id();
        String subscriptionId = SubscribeTarget.sessionSubscription(sessionId);
        EventBus.Subscription previous = state.subscriptions.remove(subscriptionId);
        if (previous != null) {
            previous.unsubscribe();
        }
        EventBus.Subscription subscription = recorder.subscribe(sessionId, sinceSeq,
                replay -> {
                    Session current = sessionStore.findById(sessionId)
                            .orElseThrow(() -> new NotFoundException("Session", sessionId));
                    sendControl(state, EnvelopeKind.SNAPSHOT, sessionId,
                            new Snapshot(current, replay.events(), replay.lastSeq()));
                },
                event -> send(state, Envelope.of(EnvelopeKind.EVENT, sessionId, event.seq(),
                        new LoggedEvent(event), clock.instant())));
        state.subscriptions.put(subscriptionId, subscription);
        log.debug("Connection {} subscribed to session {} since {}", state.connection.id(), sessionId, sinceSeq);
    }

    private static void replaceSubscription(ConnectionState state, String subscriptionId,
                                            EventBus.Subscription subscription) {
        EventBus.Subscription previous = state.subscriptions.put(subscriptionId, subscription);
        if (previous != null) {
            previous.unsubscribe();
        }
    }

    private RepoSummary summarize(Repo repo) {
        return new RepoSummary(repo, sessionStore.statsForRepo(repo.id()));
    }

    private void publishRepoActivity(String sessionId) {
        try {
            Session session = sessionStore.findById(sessionId).orElse(null);
            Repo repo = session == null ? null : repoStore.findById(session.repoId()).orElse(null);
            if (repo == null) {
                return;
            }
            RepoSummary summary = summarize(repo);
            String repoSubscription = SubscribeTarget.repoSubscription(repo.id());
            for (ConnectionState state : connections.values()) {
                if (state.subscriptions.containsKey(SubscribeTarget.REPO_LIST_SUBSCRIPTION)) {
                    sendControl(state, EnvelopeKind.EVENT, null, new RepoActivity(summary));
                }
                if (state.subscriptions.containsKey(repoSubscription)) {
                    sendControl(state, EnvelopeKind.EVENT, sessionId, new SessionUpdated(session));
                }
            }
        } catch (Exception e) {
            log.warn("Failed to publish repo activity for session {}: {}", sessionId, e.getMessage(), e);
        }
    }

    private boolean anyRepoWatchers() {
        for (ConnectionState state : connections.values()) {
            if (state.watchesRepos()) {
                return true;
            }
        }
        return false;
    }

    // -- liveness --

    private void onLifecycleEvent(SessionEvent event) {
        boolean lifecycle = false;
        if ("session.started".equals(event.type())) {
            trackIfActive(event.sessionId());
            lifecycle = true;
        } else if ("session.status_changed".equals(event.type())) {
            Object to = event.payload().get("to");
            if (to instanceof String status && SessionStatus.fromWire(status).isTerminal()) {
                liveness.forget(event.sessionId());
            }
            lifecycle = true;
        }
        if (lifecycle && anyRepoWatchers()) {
            String sessionId = event.sessionId();
            commandExecutor.execute(() -> publishRepoActivity(sessionId));
        }
    }

    /**
     * Refreshes liveness for a session, unless it has already ended. A terminal transition after
     * the refresh is caught by the {@code session.status_changed} listener.
     */
    private void trackIfActive(String sessionId) {
        liveness.record(sessionId, clock.instant());
        boolean terminal = sessionStore.findById(sessionId).map(Session::isTerminal).orElse(true);
        if (terminal) {
            liveness.forget(sessionId);
        }
    }

    /**
     * Fails every tracked session whose agent has missed too many heartbeats.
     */
    void checkLiveness() {
        for (LivenessTracker.Expired expired : liveness.expired(clock.instant())) {
            onHeartbeatTimeout(expired);
        }
    }

    private void checkLivenessSafely() {
        try {
            checkLiveness();
        } catch (Exception e) {
            log.warn("Liveness check failed: {}", e.getMessage(), e);
        }
    }

    private void onHeartbeatTimeout(LivenessTracker.Expired expired) {
        String sessionId = expired.sessionId();
        liveness.forget(sessionId);
        var failure = new LivenessException(sessionId, expired.missedHeartbeats(), expired.lastHeartbeatAt());
        MdcContext.setSession(sessionId);
        MdcContext.setPhase("liveness");
        try {
            log.warn(failure.getMessage());
            metrics.recordLivenessTimeout();
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("missedHeartbeats", failure.getMissedHeartbeats());
            detail.put("lastHeartbeatAt", EnvelopeCodec.formatTimestamp(failure.getLastHeartbeatAt()));
            detail.put("error", failure.getMessage());
            boolean failed = orchestrator.failSession(sessionId, "liveness", detail);

            ConnectionState agent = agents.remove(sessionId);
            if (agent != null) {
                agent.agentSessionId = null;
                agent.connection.close("Heartbeat timeout");
            }
            if (failed) {
                orchestrator.releaseContainer(sessionId);
            }
        } finally {
            MdcContext.clear();
        }
    }

    boolean isTracked(String sessionId) {
        return liveness.isTracked(sessionId);
    }

    // -- sending --

    private Session requireSession(Envelope envelope) {
        if (envelope.sessionId() == null || envelope.sessionId().isBlank()) {
            throw new ProtocolException(ProtocolException.INVALID_MESSAGE,
                    envelope.kind().wireName() + " frames require a sessionId");
        }
        return sessionStore.findById(envelope.sessionId())
                .orElseThrow(() -> new ProtocolException(ProtocolException.UNKNOWN_SESSION,
                        "Unknown session: " + envelope.sessionId()));
    }

    private void sendControl(ConnectionState state, EnvelopeKind kind, String sessionId, EnvelopePayload payload) {
        send(state, Envelope.of(kind, sessionId, state.controlSeq.incrementAndGet(), payload, clock.instant()));
    }

    private void sendError(ConnectionState state, Envelope inbound, String code, String message) {
        Map<String, Object> details = inbound == null ? Map.of() : Map.of("inReplyTo", inbound.seq());
        sendControl(state, EnvelopeKind.ERROR, inbound == null ? null : inbound.sessionId(),
                new ErrorReply(code, message, details));
    }

    private boolean send(ConnectionState state, Envelope envelope) {
        if (!state.connection.isOpen()) {
            return false;
        }
        try {
            state.connection.send(codec.encode(envelope));
            return true;
        } catch (IOException | RuntimeException e) {
            log.debug("Send to connection {} failed: {}", state.connection.id(), e.getMessage());
            return false;
        }
    }

    public int connectionCount() {
        return connections.size();
    }

    public int agentCount() {
        return agents.size();
    }

    private static Map<String, Object> detail(String key, Object value) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put(key, value);
        return detail;
    }

    private static final class ConnectionState {
        private final GatewayConnection connection;
        private final AtomicLong controlSeq = new AtomicLong();
        private final Map<String, EventBus.Subscription> subscriptions = new ConcurrentHashMap<>();
        // last accepted inbound seq per session; "" keys frames without one
        private final Map<String, Long> inboundSeqs = new HashMap<>();
        private volatile String agentSessionId;

        private ConnectionState(GatewayConnection connection) {
            this.connection = connection;
        }

        private synchronized void acceptSeq(Envelope envelope) {
            String key = envelope.sessionId() == null ? "" : envelope.sessionId();
            Long last = inboundSeqs.get(key);
            if (last != null && envelope.seq() <= last) {
                throw new ProtocolException(ProtocolException.OUT_OF_ORDER,
                        "seq " + envelope.seq() + " is not after " + last);
            }
            inboundSeqs.put(key, envelope.seq());
        }

        private boolean watchesRepos() {
            for (String subscriptionId : subscriptions.keySet()) {
                if (!subscriptionId.startsWith("session:")) {
                    return true;
                }
            }
            return false;
        }
    }
}
