package com.agentmanager.core.state;

import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.events.EventBus;
import com.agentmanager.core.events.InMemoryEventLog;
import com.agentmanager.core.events.SessionEventRecorder;
import com.agentmanager.core.metrics.AgentManagerMetrics;
import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.core.model.SessionRole;
import com.agentmanager.core.model.SessionStatus;
import com.agentmanager.core.persistence.SessionStore;
import com.agentmanager.support.InMemoryCore;
import com.agentmanager.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SessionStateMachineTest {

    @Nested
    @DisplayName("next")
    class NextTests {

        @Test
        @DisplayName("starting moves to running when the process starts")
        void startingToRunning() {
            assertEquals(Optional.of(SessionStatus.RUNNING),
                    SessionStateMachine.next(SessionStatus.STARTING, SessionTrigger.PROCESS_STARTED));
        }

        @Test
        @DisplayName("running and waiting alternate on idle and resume")
        void runningWaitingCycle() {
            assertEquals(Optional.of(SessionStatus.WAITING),
                    SessionStateMachine.next(SessionStatus.RUNNING, SessionTrigger.IDLE));
            assertEquals(Optional.of(SessionStatus.RUNNING),
                    SessionStateMachine.next(SessionStatus.WAITING, SessionTrigger.RESUMED));
        }

        @Test
        @DisplayName("result finishes a running or waiting session but not a starting one")
        void resultFinishes() {
            assertEquals(Optional.of(SessionStatus.FINISHED),
                    SessionStateMachine.next(SessionStatus.RUNNING, SessionTrigger.RESULT));
            assertEquals(Optional.of(SessionStatus.FINISHED),
                    SessionStateMachine.next(SessionStatus.WAITING, SessionTrigger.RESULT));
            assertEquals(Optional.empty(),
                    SessionStateMachine.next(SessionStatus.STARTING, SessionTrigger.RESULT));
        }

        @ParameterizedTest
        @EnumSource(value = SessionStatus.class, names = {"STARTING", "RUNNING", "WAITING"})
        @DisplayName("failure and stop apply to every active status")
        void failureAndStopFromActive(SessionStatus from) {
            assertEquals(Optional.of(SessionStatus.ERROR), SessionStateMachine.next(from, SessionTrigger.FAILURE));
            assertEquals(Optional.of(SessionStatus.STOPPED), SessionStateMachine.next(from, SessionTrigger.STOP));
        }

        @ParameterizedTest
        @EnumSource(value = SessionStatus.class, names = {"FINISHED", "ERROR", "STOPPED"})
        @DisplayName("terminal statuses reject every trigger")
        void terminalRejects(SessionStatus from) {
            for (SessionTrigger trigger : SessionTrigger.values()) {
                assertThrows(IllegalTransitionException.class, () -> SessionStateMachine.next(from, trigger));
            }
        }

        @Test
        @DisplayName("a duplicate process.started is ignored")
        void duplicateStartIgnored() {
            assertEquals(Optional.empty(),
                    SessionStateMachine.next(SessionStatus.RUNNING, SessionTrigger.PROCESS_STARTED));
            assertEquals(Optional.empty(),
                    SessionStateMachine.next(SessionStatus.WAITING, SessionTrigger.IDLE));
        }
    }

    @Nested
    @DisplayName("apply")
    class ApplyTests {

        private InMemoryCore core;
        private Session session;

        @BeforeEach
        void setUp() {
            core = new InMemoryCore();
            Repo repo = core.repo();
            session = core.session(repo, SessionRole.IMPLEMENTER);
        }

        @Test
        @DisplayName("persists the new status and logs session.status_changed")
        void persistsAndLogs() {
            Transition t = core.stateMachine.apply(session.id(), SessionTrigger.PROCESS_STARTED);

            assertTrue(t.changed());
            assertEquals(SessionStatus.RUNNING, core.sessionStore.findById(session.id()).orElseThrow().status());
            SessionEvent event = core.events(session.id(), "session.status_changed").get(0);
            assertEquals("starting", event.payload().get("from"));
            assertEquals("running", event.payload().get("to"));
            assertEquals("PROCESS_STARTED", event.payload().get("trigger"));
        }

        @Test
        @DisplayName("an inapplicable trigger changes nothing and logs nothing")
        void inapplicableIsNoop() {
            Transition t = core.stateMachine.apply(session.id(), SessionTrigger.IDLE);

            assertFalse(t.changed());
            assertEquals(SessionStatus.STARTING, t.to());
            assertTrue(core.eventTypes(session.id()).isEmpty());
        }

        @Test
        @DisplayName("terminal sessions stay terminal")
        void terminalIsFrozen() {
            core.stateMachine.apply(session.id(), SessionTrigger.STOP);

            assertThrows(IllegalTransitionException.class,
                    () -> core.stateMachine.apply(session.id(), SessionTrigger.PROCESS_STARTED));
            assertEquals(Optional.empty(), core.stateMachine.applyIfActive(session.id(), SessionTrigger.FAILURE));
            Session stored = core.sessionStore.findById(session.id()).orElseThrow();
            assertEquals(SessionStatus.STOPPED, stored.status());
            assertNotNull(stored.finishedAt());
        }

        @Test
        @DisplayName("unknown sessions are reported as not found")
        void unknownSession() {
            assertThrows(NotFoundException.class, () -> core.stateMachine.apply("nope", SessionTrigger.STOP));
        }

        @Test
        @DisplayName("counts transitions by from/to")
        void countsTransitions() {
            core.stateMachine.apply(session.id(), SessionTrigger.PROCESS_STARTED);

            var counter = core.registry.find("agentmanager.session.transitions")
                    .tag("from", "starting").tag("to", "running").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }
    }

    @Test
    @DisplayName("gives up with StaleStateException when every compare-and-set loses")
    void staleAfterRepeatedConflicts() {
        var clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        var metrics = new AgentManagerMetrics(new SimpleMeterRegistry());
        var recorder = new SessionEventRecorder(new InMemoryEventLog(clock), new EventBus(), metrics);
        SessionStore store = mock(SessionStore.class);
        Instant now = clock.instant();
        Session running = new Session("s-1", "r-1", SessionRole.IMPLEMENTER, SessionStatus.RUNNING,
                null, "main", null, null, null, "sonnet", now, now, null, null);
        when(store.findById("s-1")).thenReturn(Optional.of(running));
        when(store.compareAndSetStatus(anyString(), any(), any())).thenReturn(false);

        var machine = new SessionStateMachine(store, recorder, metrics);

        assertThrows(StaleStateException.class, () -> machine.apply("s-1", SessionTrigger.IDLE));
        verify(store, times(SessionStateMachine.MAX_ATTEMPTS))
                .compareAndSetStatus("s-1", SessionStatus.RUNNING, SessionStatus.WAITING);
    }
}
