package com.agentmanager.core.orchestrator;

import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionStatus;
import com.agentmanager.core.persistence.SessionStore;
import com.agentmanager.runner.RunnerProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically fails sessions that have been {@code starting} for longer than the provisioning
 * timeout, e.g. because the manager crashed in the middle of a pipeline.
 */
@Service
public class ProvisioningReconciler {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningReconciler.class);

    private final SessionStore sessionStore;
    private final SessionOrchestrator orchestrator;
    private final RunnerProperties properties;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public ProvisioningReconciler(SessionStore sessionStore, SessionOrchestrator orchestrator,
                                  RunnerProperties properties, Clock clock) {
        this.sessionStore = sessionStore;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        int interval = properties.getReconcileIntervalSeconds();
        if (interval <= 0) {
            log.info("Provisioning reconciliation disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "provisioning-reconciler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::reconcileSafely, interval, interval, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * @return number of sessions failed by this pass
     */
    public int reconcile() {
        Duration timeout = Duration.ofSeconds(properties.getProvisioningTimeoutSeconds());
        Instant cutoff = clock.instant().minus(timeout);
        List<Session> stuck = sessionStore.findByStatus(SessionStatus.STARTING).stream()
                .filter(s -> s.createdAt().isBefore(cutoff))
                .toList();
        for (Session session : stuck) {
            orchestrator.failStuckSession(session,
                    "Provisioning did not complete within " + timeout.toSeconds() + "s");
        }
        if (!stuck.isEmpty()) {
            log.info("Reconciliation failed {} stuck session(s)", stuck.size());
        }
        return stuck.size();
    }

    private void reconcileSafely() {
        try {
            reconcile();
        } catch (Exception e) {
            log.warn("Provisioning reconciliation pass failed: {}", e.getMessage(), e);
        }
    }
}
