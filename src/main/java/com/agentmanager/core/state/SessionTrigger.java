package com.agentmanager.core.state;

/**
 * Inputs that can move a session between statuses.
 */
public enum SessionTrigger {
    /** The agent process reported it is up. */
    PROCESS_STARTED,
    /** The agent finished a turn and waits for input. */
    IDLE,
    /** A command arrived, or the agent resumed on its own. */
    RESUMED,
    /** The agent produced a clean final result. */
    RESULT,
    /** Any failure: provisioning, process error, unexpected exit, liveness or shutdown timeout. */
    FAILURE,
    /** Stop or abort requested by an operator. */
    STOP
}
