package com.agentmanager.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

@Configuration
public class RunnerConfig {

    private static final Logger log = LoggerFactory.getLogger(RunnerConfig.class);

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    private static final long CLI_TIMEOUT_SECONDS = 300;

    // runs inside GET /api/sessions/{id}
    private static final long PR_LOOKUP_TIMEOUT_SECONDS = 15;

    @Bean
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public ContainerSupervisor dockerContainerSupervisor(DockerClient dockerClient, RunnerProperties properties) {
        return new DockerContainerSupervisor(dockerClient, properties.getClaudeConfigPath(),
                properties.getStopGraceSeconds());
    }

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner(CLI_TIMEOUT_SECONDS);
    }

    @Bean
    public WorktreeProvisioner worktreeProvisioner(RunnerProperties properties, ProcessRunner processRunner) {
        log.info("Worktrees under {}", properties.getWorkspaceRoot());
        return new GitWorktreeProvisioner(properties.getWorkspaceRoot(), properties.getGitBaseUrl(), processRunner);
    }

    @Bean
    public CredentialBroker credentialBroker(RunnerProperties properties, ProcessRunner processRunner) {
        if (properties.isGithubTokenConfigured()) {
            log.info("Using configured GitHub token for agent sessions");
            return new StaticCredentialBroker(properties.getGithubToken());
        }
        log.info("Using gh CLI login for agent session tokens");
        return new GhCliCredentialBroker(processRunner);
    }

    @Bean
    public PullRequestFinder pullRequestFinder(RunnerProperties properties, ObjectMapper objectMapper) {
        if (!properties.isPrLookupEnabled()) {
            log.info("Pull request lookup disabled");
            return (owner, name, branch) -> Optional.empty();
        }
        return new GhCliPullRequestFinder(new ProcessRunner(PR_LOOKUP_TIMEOUT_SECONDS), objectMapper);
    }
}
