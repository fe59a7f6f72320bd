package com.agentmanager.core.health;

import com.agentmanager.gateway.SessionGateway;
import com.agentmanager.runner.ContainerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final ContainerSupervisor containerSupervisor;
    private final SessionGateway gateway;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) ContainerSupervisor containerSupervisor,
            @Autowired(required = false) SessionGateway gateway) {
        this.dataSource = dataSource;
        this.containerSupervisor = containerSupervisor;
        this.gateway = gateway;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkDocker());
        results.add(checkGateway());
        return results;
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured, using in-memory stores", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkDocker() {
        if (containerSupervisor == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No ContainerSupervisor configured", Map.of());
        }
        try {
            if (containerSupervisor.isAvailable()) {
                return new HealthStatus("docker", HealthStatus.Status.UP,
                        "Container runtime reachable", Map.of());
            }
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Container runtime not reachable", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkGateway() {
        if (gateway == null) {
            return new HealthStatus("gateway", HealthStatus.Status.DOWN,
                    "Gateway not available", Map.of());
        }
        return new HealthStatus("gateway", HealthStatus.Status.UP, "Gateway accepting connections",
                Map.of("connections", String.valueOf(gateway.connectionCount()),
                        "agents", String.valueOf(gateway.agentCount())));
    }
}
