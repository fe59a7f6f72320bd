package com.agentmanager.core.metrics;

import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.SessionRole;
import com.agentmanager.core.model.SessionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session lifecycle and gateway traffic.
 */
@Service
public class AgentManagerMetrics {

    private final MeterRegistry registry;

    public AgentManagerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProvisioning(SessionRole role, boolean succeeded, long ms) {
        Timer.builder("agentmanager.provisioning.duration")
                .tag("role", role.wireName())
                .tag("outcome", succeeded ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordProvisioningFailure(String step) {
        Counter.builder("agentmanager.provisioning.failures")
                .tag("step", step)
                .register(registry)
                .increment();
    }

    public void recordOrchestratorConflict() {
        Counter.builder("agentmanager.orchestrator.conflicts")
                .description("Orchestrator starts rejected because one was already active")
                .register(registry)
                .increment();
    }

    public void recordTransition(SessionStatus from, SessionStatus to) {
        Counter.builder("agentmanager.session.transitions")
                .tag("from", from.wireName())
                .tag("to", to.wireName())
                .register(registry)
                .increment();
    }

    public void recordEventAppended(EventSource source) {
        Counter.builder("agentmanager.events.appended")
                .tag("source", source.wireName())
                .register(registry)
                .increment();
    }

    public void recordProtocolError(String code) {
        Counter.builder("agentmanager.gateway.protocol_errors")
                .tag("code", code)
                .register(registry)
                .increment();
    }

    public void recordLivenessTimeout() {
        Counter.builder("agentmanager.gateway.liveness_timeouts")
                .register(registry)
                .increment();
    }

    public void recordShutdownTimeout() {
        Counter.builder("agentmanager.session.shutdown_timeouts")
                .description("Stops or aborts that fell back to a force kill")
                .register(registry)
                .increment();
    }
}
