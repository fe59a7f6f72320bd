package com.agentmanager.core.state;

import com.agentmanager.core.errors.AgentManagerException;
import com.agentmanager.core.model.SessionStatus;

/**
 * Thrown for any trigger applied to a session that is already terminal.
 */
public class IllegalTransitionException extends AgentManagerException {

    private final SessionStatus from;
    private final SessionTrigger trigger;

    public IllegalTransitionException(SessionStatus from, SessionTrigger trigger) {
        super("ILLEGAL_TRANSITION", "Session is " + from.wireName() + "; cannot apply " + trigger);
        this.from = from;
        this.trigger = trigger;
    }

    public SessionStatus getFrom() {
        return from;
    }

    public SessionTrigger getTrigger() {
        return trigger;
    }
}
