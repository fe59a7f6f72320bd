package com.agentmanager.core.state;

import com.agentmanager.core.errors.AgentManagerException;

/**
 * The session's status kept changing underneath every compare-and-set attempt.
 */
public class StaleStateException extends AgentManagerException {

    public StaleStateException(String sessionId, SessionTrigger trigger, int attempts) {
        super("STALE_STATE", "Could not apply " + trigger + " to session " + sessionId
                + " after " + attempts + " attempts");
    }
}
