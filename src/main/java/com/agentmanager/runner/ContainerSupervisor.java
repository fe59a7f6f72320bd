package com.agentmanager.runner;

/**
 * Starts and stops the sandbox container that runs a session's agent process.
 */
public interface ContainerSupervisor {

    /**
     * Creates and starts the container.
     * @return the container ID
     */
    String startContainer(ContainerSpec spec);

    /**
     * Stops the container gracefully and removes it. A container that is already gone counts as stopped.
     * May block for the runtime's grace period; callers bound it with their own timeout.
     */
    void stopContainer(String containerId);

    /**
     * Kills and removes the container without a grace period.
     */
    void killContainer(String containerId);

    /**
     * Whether the container runtime is reachable.
     */
    default boolean isAvailable() {
        return true;
    }
}
