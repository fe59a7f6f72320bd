package com.agentmanager.core.state;

import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.events.SessionEventRecorder;
import com.agentmanager.core.metrics.AgentManagerMetrics;
import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionStatus;
import com.agentmanager.core.persistence.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns {@link Session#status()}: nothing else writes it.
 * <p>
 * <pre>
 * starting --PROCESS_STARTED--> running --IDLE--> waiting --RESUMED--> running
 * running | waiting --RESULT--> finished
 * starting | running | waiting --FAILURE--> error
 * starting | running | waiting --STOP--> stopped
 * </pre>
 * Terminal statuses accept no trigger. A trigger that does not apply to a non-terminal
 * status (a duplicate {@code process.started}, say) is ignored.
 * <p>
 * Writes are compare-and-set against the status that was read; when another writer got there
 * first the status is re-read and the trigger re-evaluated against it.
 */
@Service
public class SessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    static final int MAX_ATTEMPTS = 5;

    private final SessionStore sessionStore;
    private final SessionEventRecorder recorder;
    private final AgentManagerMetrics metrics;

    public SessionStateMachine(SessionStore sessionStore, SessionEventRecorder recorder,
                               AgentManagerMetrics metrics) {
        this.sessionStore = sessionStore;
        this.recorder = recorder;
        this.metrics = metrics;
    }

    /**
     * Pure transition function.
     *
     * @return the target status, or empty if the trigger does not apply to {@code from}
     * @throws IllegalTransitionException if {@code from} is terminal
     */
    public static Optional<SessionStatus> next(SessionStatus from, SessionTrigger trigger) {
        if (from.isTerminal()) {
            throw new IllegalTransitionException(from, trigger);
        }
        SessionStatus to = switch (trigger) {
            case PROCESS_STARTED -> from == SessionStatus.STARTING ? SessionStatus.RUNNING : null;
            case IDLE -> from == SessionStatus.RUNNING ? SessionStatus.WAITING : null;
            case RESUMED -> from == SessionStatus.WAITING ? SessionStatus.RUNNING : null;
            case RESULT -> from == SessionStatus.RUNNING || from == SessionStatus.WAITING
                    ? SessionStatus.FINISHED : null;
            case FAILURE -> SessionStatus.ERROR;
            case STOP -> SessionStatus.STOPPED;
        };
        return Optional.ofNullable(to);
    }

    /**
     * Applies {@code trigger} to the stored session and, if the status changed, appends a
     * {@code session.status_changed} event.
     *
     * @throws IllegalTransitionException if the session is terminal
     * @throws StaleStateException        if every compare-and-set attempt lost a race
     */
    public Transition apply(String sessionId, SessionTrigger trigger) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Session current = sessionStore.findById(sessionId)
                    .orElseThrow(() -> new NotFoundException("Session", sessionId));
            SessionStatus from = current.status();
            Optional<SessionStatus> to = next(from, trigger);
            if (to.isEmpty()) {
                log.debug("Trigger {} does not apply to session {} in {}", trigger, sessionId, from.wireName());
                return new Transition(sessionId, from, from, trigger);
            }
            if (sessionStore.compareAndSetStatus(sessionId, from, to.get())) {
                log.info("Session {} {} -> {} ({})", sessionId, from.wireName(), to.get().wireName(), trigger);
                metrics.recordTransition(from, to.get());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("from", from.wireName());
                payload.put("to", to.get().wireName());
                payload.put("trigger", trigger.name());
                recorder.record(sessionId, EventSource.MANAGER, "session.status_changed", payload);
                return new Transition(sessionId, from, to.get(), trigger);
            }
            log.debug("Status of session {} changed concurrently (attempt {}), re-reading", sessionId, attempt);
        }
        throw new StaleStateException(sessionId, trigger, MAX_ATTEMPTS);
    }

    /**
     * Like {@link #apply} but returns empty instead of throwing when the session is already terminal.
     */
    public Optional<Transition> applyIfActive(String sessionId, SessionTrigger trigger) {
        try {
            return Optional.of(apply(sessionId, trigger));
        } catch (IllegalTransitionException e) {
            log.debug("Ignoring {} for session {}: {}", trigger, sessionId, e.getMessage());
            return Optional.empty();
        }
    }
}
