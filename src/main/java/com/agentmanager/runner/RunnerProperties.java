package com.agentmanager.runner;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "agentmanager")
public class RunnerProperties {

    private Runner runner = new Runner();
    private Github github = new Github();

    // -- Runner accessors (delegate to nested) --
    public String getContainerImage() { return runner.containerImage; }
    public Path getWorkspaceRoot() { return Path.of(runner.workspaceRoot); }
    public int getMemoryLimitMb() { return runner.memoryLimitMb; }
    public int getCpuCount() { return runner.cpuCount; }
    public int getStopTimeoutSeconds() { return runner.stopTimeoutSeconds; }
    public int getStopGraceSeconds() { return runner.stopGraceSeconds; }
    public int getProvisioningTimeoutSeconds() { return runner.provisioningTimeoutSeconds; }
    public int getReconcileIntervalSeconds() { return runner.reconcileIntervalSeconds; }
    public String getClaudeConfigPath() { return runner.claudeConfigPath; }
    public String getGitBaseUrl() { return runner.gitBaseUrl; }
    public String getGatewayUrl() { return runner.gatewayUrl; }
    public String getDefaultModel() { return runner.defaultModel; }
    public String getBaseSystemPrompt() { return runner.baseSystemPrompt; }

    // -- GitHub accessors (delegate to nested) --

    /**
     * Returns true when a GitHub token was configured explicitly (e.g. {@code GH_TOKEN}).
     * Otherwise tokens are obtained from the {@code gh} CLI for each session.
     */
    public boolean isGithubTokenConfigured() {
        return github.token != null && !github.token.isBlank();
    }
    public String getGithubToken() { return github.token; }
    public boolean isPrLookupEnabled() { return github.prLookup; }

    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }
    public Github getGithub() { return github; }
    public void setGithub(Github github) { this.github = github; }

    public static class Runner {
        private String containerImage = "agent-manager-sandbox:latest";
        private String workspaceRoot = System.getProperty("user.home") + "/.agent-manager";
        private int memoryLimitMb = 4096;
        private int cpuCount = 2;
        private int stopTimeoutSeconds = 30;
        private int stopGraceSeconds = 10;
        private int provisioningTimeoutSeconds = 600;
        private int reconcileIntervalSeconds = 60;
        private String claudeConfigPath = System.getProperty("user.home") + "/.claude";
        private String gitBaseUrl = "https://github.com";
        private String gatewayUrl = "ws://host.docker.internal:8080/ws";
        private String defaultModel = "sonnet";
        private String baseSystemPrompt;

        public String getContainerImage() { return containerImage; }
        public void setContainerImage(String containerImage) { this.containerImage = containerImage; }
        public String getWorkspaceRoot() { return workspaceRoot; }
        public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuCount() { return cpuCount; }
        public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
        public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
        public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
        public int getStopGraceSeconds() { return stopGraceSeconds; }
        public void setStopGraceSeconds(int stopGraceSeconds) { this.stopGraceSeconds = stopGraceSeconds; }
        public int getProvisioningTimeoutSeconds() { return provisioningTimeoutSeconds; }
        public void setProvisioningTimeoutSeconds(int provisioningTimeoutSeconds) { this.provisioningTimeoutSeconds = provisioningTimeoutSeconds; }
        public int getReconcileIntervalSeconds() { return reconcileIntervalSeconds; }
        public void setReconcileIntervalSeconds(int reconcileIntervalSeconds) { this.reconcileIntervalSeconds = reconcileIntervalSeconds; }
        public String getClaudeConfigPath() { return claudeConfigPath; }
        public void setClaudeConfigPath(String claudeConfigPath) { this.claudeConfigPath = claudeConfigPath; }
        public String getGitBaseUrl() { return gitBaseUrl; }
        public void setGitBaseUrl(String gitBaseUrl) { this.gitBaseUrl = gitBaseUrl; }
        public String getGatewayUrl() { return gatewayUrl; }
        public void setGatewayUrl(String gatewayUrl) { this.gatewayUrl = gatewayUrl; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public String getBaseSystemPrompt() { return baseSystemPrompt; }
        public void setBaseSystemPrompt(String baseSystemPrompt) { this.baseSystemPrompt = baseSystemPrompt; }
    }

    public static class Github {
        private String token;
        /** Look up the pull request of a session branch when the session is read. */
        private boolean prLookup = true;

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public boolean isPrLookup() { return prLookup; }
        public void setPrLookup(boolean prLookup) { this.prLookup = prLookup; }
    }
}
