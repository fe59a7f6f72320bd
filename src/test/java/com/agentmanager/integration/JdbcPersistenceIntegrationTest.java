package com.agentmanager.integration;

import com.agentmanager.core.errors.ConflictException;
import com.agentmanager.core.events.JdbcEventLog;
import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.NewSession;
import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.RepoStats;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.core.model.SessionRole;
import com.agentmanager.core.model.SessionStatus;
import com.agentmanager.core.persistence.JdbcRepoStore;
import com.agentmanager.core.persistence.JdbcSessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs the JDBC stores against a real PostgreSQL.
 * Requires AGENT_MANAGER_TEST_DATABASE_URL (plus _USERNAME / _PASSWORD when needed).
 * Run with: mvn test -Dtest.excludedGroups=none
 */
@Tag("integration")
class JdbcPersistenceIntegrationTest {

    private static DriverManagerDataSource dataSource;

    private final Clock clock = Clock.systemUTC();
    private JdbcRepoStore repoStore;
    private JdbcSessionStore sessionStore;
    private JdbcEventLog eventLog;
    private Repo repo;

    @BeforeAll
    static void connect() {
        String url = System.getenv("AGENT_MANAGER_TEST_DATABASE_URL");
        assumeTrue(url != null && !url.isBlank(), "AGENT_MANAGER_TEST_DATABASE_URL not set");
        dataSource = new DriverManagerDataSource(url,
                System.getenv().getOrDefault("AGENT_MANAGER_TEST_DATABASE_USERNAME", "postgres"),
                System.getenv().getOrDefault("AGENT_MANAGER_TEST_DATABASE_PASSWORD", ""));
    }

    @BeforeEach
    void setUp() throws Exception {
        repoStore = new JdbcRepoStore(dataSource, clock);
        sessionStore = new JdbcSessionStore(dataSource, clock);
        eventLog = new JdbcEventLog(dataSource, new ObjectMapper().findAndRegisterModules(), clock);
        repoStore.createTables();
        sessionStore.createTables();
        eventLog.createTables();
        // fresh repo per test so reruns against the same database do not collide
        repo = repoStore.register("it-" + UUID.randomUUID(), "widgets", "main");
    }

    private Session insert(SessionRole role) {
        String id = UUID.randomUUID().toString();
        return sessionStore.insert(new NewSession(id, repo.id(), role, "agent/widgets/" + id.substring(0, 8),
                "main", "Integration goal", "sonnet", clock.instant()));
    }

    @Test
    void registeringTheSameRepoTwiceReturnsTheSameRow() {
        Repo again = repoStore.register(repo.owner(), repo.name(), "develop");

        assertEquals(repo.id(), again.id());
        assertEquals("main", again.defaultBranch());
    }

    @Test
    void secondActiveOrchestratorIsRejectedByTheDatabase() {
        Session first = insert(SessionRole.ORCHESTRATOR);

        assertThrows(ConflictException.class, () -> insert(SessionRole.ORCHESTRATOR));

        assertTrue(sessionStore.compareAndSetStatus(first.id(), SessionStatus.STARTING, SessionStatus.ERROR));
        assertDoesNotThrow(() -> insert(SessionRole.ORCHESTRATOR));
    }

    @Test
    void compareAndSetOnlyMovesFromTheExpectedStatus() {
        Session session = insert(SessionRole.IMPLEMENTER);

        assertFalse(sessionStore.compareAndSetStatus(session.id(), SessionStatus.RUNNING, SessionStatus.WAITING));
        assertTrue(sessionStore.compareAndSetStatus(session.id(), SessionStatus.STARTING, SessionStatus.RUNNING));
        assertTrue(sessionStore.compareAndSetStatus(session.id(), SessionStatus.RUNNING, SessionStatus.STOPPED));

        Session stopped = sessionStore.findById(session.id()).orElseThrow();
        assertEquals(SessionStatus.STOPPED, stopped.status());
        assertNotNull(stopped.finishedAt());
    }

    @Test
    void provisioningAndPullRequestUpdatesSkipTerminalRows() {
        Session session = insert(SessionRole.IMPLEMENTER);
        Session provisioned = sessionStore.updateProvisioning(session.id(), session.branchName(), "/work/wt", null);
        assertEquals("/work/wt", provisioned.worktreePath());
        assertEquals("https://github.com/acme/widgets/pull/3",
                sessionStore.recordPullRequest(session.id(), "https://github.com/acme/widgets/pull/3").lastKnownPrUrl());

        sessionStore.compareAndSetStatus(session.id(), SessionStatus.STARTING, SessionStatus.STOPPED);
        Session stopped = sessionStore.updateProvisioning(session.id(), session.branchName(), "/work/wt", "container-1");
        Session unchanged = sessionStore.recordPullRequest(session.id(), "https://github.com/acme/widgets/pull/4");

        assertNull(stopped.containerId());
        assertEquals("https://github.com/acme/widgets/pull/3", unchanged.lastKnownPrUrl());
    }

    @Test
    void statsCountActiveAndErroredSessions() {
        Session running = insert(SessionRole.IMPLEMENTER);
        sessionStore.compareAndSetStatus(running.id(), SessionStatus.STARTING, SessionStatus.RUNNING);
        Session failed = insert(SessionRole.IMPLEMENTER);
        sessionStore.compareAndSetStatus(failed.id(), SessionStatus.STARTING, SessionStatus.ERROR);

        RepoStats stats = sessionStore.statsForRepo(repo.id());

        assertEquals(2, stats.totalSessions());
        assertEquals(1, stats.activeSessions());
        assertTrue(stats.hasRunning());
        assertTrue(stats.hasError());
        assertFalse(stats.hasWaiting());
    }

    @Test
    void concurrentAppendsGetGapFreeSeqs() throws Exception {
        Session session = insert(SessionRole.IMPLEMENTER);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<SessionEvent>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int n = i;
                futures.add(pool.submit(() -> eventLog.append(session.id(), EventSource.AGENT, "process.stdout",
                        Map.of("line", "line " + n))));
            }
            for (Future<SessionEvent> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        List<Long> seqs = eventLog.query(session.id(), 0).stream().map(SessionEvent::seq).toList();
        assertEquals(LongStream.rangeClosed(1, 40).boxed().toList(), seqs);
        assertEquals(40, eventLog.lastSeq(session.id()));
        assertEquals(List.of(21L, 22L), eventLog.query(session.id(), 20, 2).stream().map(SessionEvent::seq).toList());
    }

    @Test
    void payloadsRoundTripAsJson() {
        Session session = insert(SessionRole.IMPLEMENTER);
        eventLog.append(session.id(), EventSource.MANAGER, "session.error",
                Map.of("phase", "liveness", "missedHeartbeats", 3));

        SessionEvent event = eventLog.query(session.id(), 0).get(0);

        assertEquals(EventSource.MANAGER, event.source());
        assertEquals("liveness", event.payload().get("phase"));
        assertEquals(3, event.payload().get("missedHeartbeats"));
    }
}
