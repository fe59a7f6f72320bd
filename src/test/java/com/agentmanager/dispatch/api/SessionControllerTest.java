package com.agentmanager.dispatch.api;

import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.errors.ProtocolException;
import com.agentmanager.core.events.SessionEventRecorder;
import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.core.model.SessionRole;
import com.agentmanager.core.model.SessionStatus;
import com.agentmanager.core.orchestrator.PullRequestTracker;
import com.agentmanager.core.orchestrator.SessionOrchestrator;
import com.agentmanager.core.persistence.SessionStore;
import com.agentmanager.gateway.SessionGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionStore sessionStore;

    @MockitoBean
    private SessionOrchestrator orchestrator;

    @MockitoBean
    private SessionEventRecorder recorder;

    @MockitoBean
    private SessionGateway gateway;

    @MockitoBean
    private PullRequestTracker pullRequests;

    @BeforeEach
    void passSessionsThroughTracker() {
        when(pullRequests.refresh(any())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static Session session(SessionStatus status) {
        return new Session("sess-1", "repo-1", SessionRole.IMPLEMENTER, status, "agent/widgets/sess-1", "main",
                "/work/worktrees/sess-1", "container-1", null, "sonnet", NOW, NOW,
                status.isTerminal() ? NOW : null, null);
    }

    @Test
    @DisplayName("GET /sessions/{id} returns the session")
    void getSession() throws Exception {
        when(sessionStore.findById("sess-1")).thenReturn(Optional.of(session(SessionStatus.WAITING)));

        mockMvc.perform(get("/api/sessions/sess-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("waiting"))
                .andExpect(jsonPath("$.repo_id").value("repo-1"));
    }

    @Test
    @DisplayName("GET /sessions/{id} reports the pull request found for the branch")
    void getSessionWithPullRequest() throws Exception {
        Session waiting = session(SessionStatus.WAITING);
        when(sessionStore.findById("sess-1")).thenReturn(Optional.of(waiting));
        when(pullRequests.refresh(waiting)).thenReturn(waiting.withPrUrl("https://github.com/acme/widgets/pull/12"));

        mockMvc.perform(get("/api/sessions/sess-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.last_known_pr_url").value("https://github.com/acme/widgets/pull/12"));
    }

    @Test
    @DisplayName("GET /sessions/{id} for an unknown session returns 404")
    void getUnknown() throws Exception {
        when(sessionStore.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sessions/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /sessions/{id} stops the session")
    void stop() throws Exception {
        when(orchestrator.stopSession("sess-1")).thenReturn(session(SessionStatus.STOPPED));

        mockMvc.perform(delete("/api/sessions/sess-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("stopped"));
    }

    @Test
    @DisplayName("DELETE /sessions/{id} for an unknown session returns 404")
    void stopUnknown() throws Exception {
        when(orchestrator.stopSession("nope")).thenThrow(new NotFoundException("Session", "nope"));

        mockMvc.perform(delete("/api/sessions/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Session not found: nope"));
    }

    @Test
    @DisplayName("POST /sessions/{id}/abort aborts the session")
    void abort() throws Exception {
        when(orchestrator.abortSession("sess-1")).thenReturn(session(SessionStatus.STOPPED));

        mockMvc.perform(post("/api/sessions/sess-1/abort"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("stopped"));

        verify(orchestrator).abortSession("sess-1");
    }

    @Test
    @DisplayName("GET /sessions/{id}/events pages from the given seq")
    void events() throws Exception {
        when(sessionStore.findById("sess-1")).thenReturn(Optional.of(session(SessionStatus.RUNNING)));
        when(recorder.history("sess-1", 5, 2)).thenReturn(List.of(
                new SessionEvent(16, "sess-1", EventSource.AGENT, "process.stdout", Map.of("line", "ok"), 6, NOW),
                new SessionEvent(17, "sess-1", EventSource.AGENT, "session.idle", Map.of(), 7, NOW)));

        mockMvc.perform(get("/api/sessions/sess-1/events").param("after", "5").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].seq").value(6))
                .andExpect(jsonPath("$[0].source").value("agent"))
                .andExpect(jsonPath("$[0].payload.line").value("ok"))
                .andExpect(jsonPath("$[1].type").value("session.idle"));
    }

    @Test
    @DisplayName("GET /sessions/{id}/events rejects out-of-range paging with 400")
    void eventsBadPaging() throws Exception {
        mockMvc.perform(get("/api/sessions/sess-1/events").param("after", "-1"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/sessions/sess-1/events").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/sessions/sess-1/events").param("limit", String.valueOf(SessionController.MAX_PAGE + 1)))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/sessions/sess-1/events").param("after", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verify(recorder, never()).history(anyString(), anyLong(), anyInt());
    }

    @Test
    @DisplayName("GET /sessions/{id}/events for an unknown session returns 404")
    void eventsUnknown() throws Exception {
        when(sessionStore.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sessions/nope/events"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /sessions/{id}/messages relays the message and reports the session status")
    void sendMessage() throws Exception {
        when(gateway.sendUserMessage("sess-1", "add tests", false)).thenReturn(
                new SessionEvent(30, "sess-1", EventSource.USER, "user.message", Map.of("message", "add tests"), 8, NOW));
        when(sessionStore.findById("sess-1")).thenReturn(Optional.of(session(SessionStatus.RUNNING)));

        mockMvc.perform(post("/api/sessions/sess-1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"add tests\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sent").value(true))
                .andExpect(jsonPath("$.event_seq").value(8))
                .andExpect(jsonPath("$.session_status").value("running"));
    }

    @Test
    @DisplayName("POST /sessions/{id}/messages passes force through")
    void sendForcedMessage() throws Exception {
        when(gateway.sendUserMessage("sess-1", "stop that", true)).thenReturn(
                new SessionEvent(31, "sess-1", EventSource.USER, "user.message", Map.of("message", "stop that"), 9, NOW));
        when(sessionStore.findById("sess-1")).thenReturn(Optional.of(session(SessionStatus.RUNNING)));

        mockMvc.perform(post("/api/sessions/sess-1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"stop that\",\"force\":true}"))
                .andExpect(status().isOk());

        verify(gateway).sendUserMessage("sess-1", "stop that", true);
    }

    @Test
    @DisplayName("POST /sessions/{id}/messages without a message returns 400")
    void sendBlankMessage() throws Exception {
        mockMvc.perform(post("/api/sessions/sess-1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verify(gateway, never()).sendUserMessage(anyString(), anyString(), anyBoolean());
    }

    @Test
    @DisplayName("POST /sessions/{id}/messages to a busy session returns 400, to an unknown one 404")
    void sendRejected() throws Exception {
        when(gateway.sendUserMessage("sess-1", "hello", false)).thenThrow(new ProtocolException(
                ProtocolException.SESSION_NOT_WAITING, "Session is running, not waiting for input"));
        when(gateway.sendUserMessage("nope", "hello", false)).thenThrow(new ProtocolException(
                ProtocolException.UNKNOWN_SESSION, "Unknown session: nope"));

        mockMvc.perform(post("/api/sessions/sess-1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_WAITING"));
        mockMvc.perform(post("/api/sessions/nope/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isNotFound());
    }
}
