package com.agentmanager.core.state;

import com.agentmanager.core.model.SessionStatus;

/**
 * Outcome of applying a trigger. {@code from == to} when the trigger did not apply.
 */
public record Transition(String sessionId, SessionStatus from, SessionStatus to, SessionTrigger trigger) {

    public boolean changed() {
        return from != to;
    }
}
