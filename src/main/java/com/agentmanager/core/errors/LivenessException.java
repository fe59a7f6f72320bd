package com.agentmanager.core.errors;

import java.time.Instant;

/**
 * Describes an agent that stopped sending heartbeats.
 */
public class LivenessException extends AgentManagerException {

    private final String sessionId;
    private final int missedHeartbeats;
    private final Instant lastHeartbeatAt;

    public LivenessException(String sessionId, int missedHeartbeats, Instant lastHeartbeatAt) {
        super("HEARTBEAT_TIMEOUT", "Session " + sessionId + " missed " + missedHeartbeats
                + " heartbeats (last at " + lastHeartbeatAt + ")");
        this.sessionId = sessionId;
        this.missedHeartbeats = missedHeartbeats;
        this.lastHeartbeatAt = lastHeartbeatAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getMissedHeartbeats() {
        return missedHeartbeats;
    }

    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }
}
