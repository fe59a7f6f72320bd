package com.agentmanager.dispatch.api;

import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.errors.ValidationException;
import com.agentmanager.core.events.SessionEventRecorder;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.core.orchestrator.PullRequestTracker;
import com.agentmanager.core.orchestrator.SessionOrchestrator;
import com.agentmanager.core.persistence.SessionStore;
import com.agentmanager.gateway.SessionGateway;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for a single session: read, message, stop, abort and page through its events.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    static final int MAX_PAGE = 1000;

    private final SessionStore sessionStore;
    private final SessionOrchestrator orchestrator;
    private final SessionEventRecorder recorder;
    private final SessionGateway gateway;
    private final PullRequestTracker pullRequests;

    public SessionController(SessionStore sessionStore, SessionOrchestrator orchestrator,
                             SessionEventRecorder recorder, SessionGateway gateway,
                             PullRequestTracker pullRequests) {
        this.sessionStore = sessionStore;
        this.orchestrator = orchestrator;
        this.recorder = recorder;
        this.gateway = gateway;
        this.pullRequests = pullRequests;
    }

    /**
     * GET /api/sessions/{id} — The session, with the pull request of its branch looked up.
     */
    @GetMapping("/{id}")
    public SessionResponse get(@PathVariable String id) {
        Session session = sessionStore.findById(id)
                .orElseThrow(() -> new NotFoundException("Session", id));
        return SessionResponse.from(pullRequests.refresh(session));
    }

    /**
     * POST /api/sessions/{id}/messages — Sends a message to the agent. Unless {@code force} is set
     * the session must be waiting for input.
     */
    @PostMapping("/{id}/messages")
    public MessageResponse sendMessage(@PathVariable String id, @RequestBody MessageRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            throw new ValidationException("message is required");
        }
        SessionEvent logged = gateway.sendUserMessage(id, request.message(), request.forced());
        Session session = sessionStore.findById(id)
                .orElseThrow(() -> new NotFoundException("Session", id));
        return new MessageResponse(true, logged.seq(), session.status().wireName());
    }

    /**
     * DELETE /api/sessions/{id} — Graceful stop. A session that already ended is returned unchanged.
     */
    @DeleteMapping("/{id}")
    public SessionResponse stop(@PathVariable String id) {
        return SessionResponse.from(orchestrator.stopSession(id));
    }

    @PostMapping("/{id}/abort")
    public SessionResponse abort(@PathVariable String id) {
        return SessionResponse.from(orchestrator.abortSession(id));
    }

    /**
     * GET /api/sessions/{id}/events?after=N&amp;limit=M — Events with seq greater than {@code after}, ascending.
     */
    @GetMapping("/{id}/events")
    public List<EventResponse> events(@PathVariable String id,
                                      @RequestParam(defaultValue = "0") long after,
                                      @RequestParam(defaultValue = "100") int limit) {
        if (after < 0) {
            throw new ValidationException("after must be >= 0");
        }
        if (limit < 1 || limit > MAX_PAGE) {
            throw new ValidationException("limit must be between 1 and " + MAX_PAGE);
        }
        if (sessionStore.findById(id).isEmpty()) {
            throw new NotFoundException("Session", id);
        }
        return recorder.history(id, after, limit).stream().map(EventResponse::from).toList();
    }
}
