package com.agentmanager.dispatch.api;

import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.errors.ValidationException;
import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.orchestrator.SessionOrchestrator;
import com.agentmanager.core.orchestrator.StartSessionRequest;
import com.agentmanager.core.persistence.RepoStore;
import com.agentmanager.core.persistence.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for repos and the sessions started on them.
 */
@RestController
@RequestMapping("/api/repos")
public class RepoController {

    private static final Logger log = LoggerFactory.getLogger(RepoController.class);

    private static final String DEFAULT_BRANCH = "main";

    private final RepoStore repoStore;
    private final SessionStore sessionStore;
    private final SessionOrchestrator orchestrator;

    public RepoController(RepoStore repoStore, SessionStore sessionStore, SessionOrchestrator orchestrator) {
        this.repoStore = repoStore;
        this.sessionStore = sessionStore;
        this.orchestrator = orchestrator;
    }

    /**
     * POST /api/repos — Register a repo. Registering the same owner/name again returns the existing one.
     */
    @PostMapping
    public ResponseEntity<RepoResponse> register(@RequestBody RepoRequest request) {
        if (request.owner() == null || request.owner().isBlank()
                || request.name() == null || request.name().isBlank()) {
            throw new ValidationException("owner and name are required");
        }
        String defaultBranch = request.defaultBranch() == null || request.defaultBranch().isBlank()
                ? DEFAULT_BRANCH : request.defaultBranch();
        Repo repo = repoStore.register(request.owner().trim(), request.name().trim(), defaultBranch);
        log.info("Registered repo {} ({})", repo.fullName(), repo.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(repo));
    }

    @GetMapping
    public List<RepoResponse> list() {
        return repoStore.findAll().stream().map(this::toResponse).toList();
    }

    @GetMapping("/{id}")
    public RepoResponse get(@PathVariable String id) {
        return toResponse(requireRepo(id));
    }

    @GetMapping("/{id}/sessions")
    public List<SessionResponse> sessions(@PathVariable String id) {
        requireRepo(id);
        return sessionStore.findByRepo(id).stream().map(SessionResponse::from).toList();
    }

    /**
     * POST /api/repos/{id}/sessions — Start a session. Blocks until provisioning has finished.
     * 201 on success, 400 for a bad role, 404 for an unknown repo, 409 when an orchestrator is
     * already active, 500 when a provisioning step failed.
     */
    @PostMapping("/{id}/sessions")
    public ResponseEntity<SessionResponse> startSession(@PathVariable String id,
                                                        @RequestBody(required = false) SessionRequest request) {
        SessionRequest body = request != null ? request : new SessionRequest(null, null, null, null, null);
        Session session = orchestrator.startSession(new StartSessionRequest(
                id, body.role(), body.baseBranch(), body.branchSuffix(), body.goalPrompt(), body.model()));
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    private Repo requireRepo(String id) {
        return repoStore.findById(id).orElseThrow(() -> new NotFoundException("Repo", id));
    }

    private RepoResponse toResponse(Repo repo) {
        return RepoResponse.from(repo, sessionStore.statsForRepo(repo.id()));
    }
}
