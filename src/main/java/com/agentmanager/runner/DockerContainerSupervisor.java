package com.agentmanager.runner;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;

/**
 * Docker-based {@link ContainerSupervisor}.
 *
 * <p>Each session container is configured with:
 * <ul>
 *   <li>A bind mount mapping the session worktree to /workspace</li>
 *   <li>The host Claude config directory mounted read-only, when present</li>
 *   <li>Environment variables telling the agent who it is and where the gateway lives</li>
 *   <li>Memory and CPU limits from the {@link ContainerSpec}</li>
 *   <li>Extra host entry for host.docker.internal so the agent can reach the gateway</li>
 *   <li>A {@value #SESSION_LABEL} label carrying the session id</li>
 * </ul>
 */
public class DockerContainerSupervisor implements ContainerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerSupervisor.class);

    public static final String SESSION_LABEL = "agent-manager.session";

    private static final String CONTAINER_CLAUDE_DIR = "/home/agent/.claude";

    private final DockerClient dockerClient;
    private final String claudeConfigPath;
    private final int stopGraceSeconds;

    public DockerContainerSupervisor(DockerClient dockerClient, String claudeConfigPath, int stopGraceSeconds) {
        this.dockerClient = dockerClient;
        this.claudeConfigPath = claudeConfigPath;
        this.stopGraceSeconds = stopGraceSeconds;
    }

    @Override
    public String startContainer(ContainerSpec spec) {
        String containerName = containerName(spec.sessionId());
        log.info("Starting container {} for session {} (image: {})", containerName, spec.sessionId(), spec.image());

        // Clean up any stale container left by an earlier attempt for this session
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (NotFoundException e) {
            log.trace("No stale container {}", containerName);
        }

        var envList = new ArrayList<String>();
        envList.add("GH_TOKEN=" + spec.credential());
        envList.add("GIT_TERMINAL_PROMPT=0");
        envList.add("AGENT_MANAGER_URL=" + spec.gatewayAddress());
        envList.add("SESSION_ID=" + spec.sessionId());
        envList.add("AGENT_ROLE=" + spec.role().wireName());
        envList.add("CLAUDE_MODEL=" + spec.model());
        if (spec.goalPrompt() != null && !spec.goalPrompt().isBlank()) {
            envList.add("GOAL_PROMPT=" + spec.goalPrompt());
        }
        if (spec.systemPrompt() != null && !spec.systemPrompt().isBlank()) {
            envList.add("SYSTEM_PROMPT=" + spec.systemPrompt());
        }

        var binds = new ArrayList<Bind>();
        binds.add(new Bind(spec.worktreePath().toString(), new Volume("/workspace"), AccessMode.rw));
        if (claudeConfigPath != null && Files.isDirectory(Path.of(claudeConfigPath))) {
            binds.add(new Bind(claudeConfigPath, new Volume(CONTAINER_CLAUDE_DIR), AccessMode.ro));
        }

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds.toArray(new Bind[0]))
                .withMemory((long) spec.memoryLimitMb() * 1024 * 1024)
                .withCpuCount((long) spec.cpuCount())
                .withExtraHosts("host.docker.internal:host-gateway");

        var response = dockerClient.createContainerCmd(spec.image())
                .withName(containerName)
                .withHostConfig(hostConfig)
                .withEnv(envList)
                .withLabels(Map.of(SESSION_LABEL, spec.sessionId()))
                .withWorkingDir("/workspace")
                .exec();

        String containerId = response.getId();
        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            log.warn("Container {} created but failed to start, removing it", containerName);
            removeQuietly(containerId);
            throw e;
        }
        log.info("Container {} started (id {})", containerName, containerId);
        return containerId;
    }

    @Override
    public void stopContainer(String containerId) {
        try {
            dockerClient.stopContainerCmd(containerId).withTimeout(stopGraceSeconds).exec();
        } catch (NotModifiedException e) {
            log.debug("Container {} was already stopped", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} no longer exists", containerId);
            return;
        }
        removeQuietly(containerId);
        log.info("Container {} stopped", containerId);
    }

    @Override
    public void killContainer(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Container {} force-removed", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} no longer exists", containerId);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (Exception e) {
            log.warn("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    static String containerName(String sessionId) {
        return "agent-session-" + sessionId;
    }

    private void removeQuietly(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
        } catch (Exception e) {
            log.warn("Failed to remove container {}: {}", containerId, e.getMessage());
        }
    }
}
