package com.agentmanager.core.orchestrator;

import java.util.Locale;

/**
 * Steps of the session provisioning pipeline, in execution order.
 */
public enum ProvisioningStep {
    WORKTREE,
    CREDENTIAL,
    CONTAINER,
    FINALIZE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
