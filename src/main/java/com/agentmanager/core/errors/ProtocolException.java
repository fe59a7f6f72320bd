package com.agentmanager.core.errors;

/**
 * A frame that violates the envelope contract, or a command the session cannot accept.
 * Answered with an {@code error} frame on the offending connection; session state is untouched.
 */
public class ProtocolException extends AgentManagerException {

    public static final String INVALID_MESSAGE = "INVALID_MESSAGE";
    public static final String UNKNOWN_KIND = "UNKNOWN_KIND";
    public static final String UNKNOWN_SESSION = "UNKNOWN_SESSION";
    public static final String UNKNOWN_REPO = "UNKNOWN_REPO";
    public static final String OUT_OF_ORDER = "OUT_OF_ORDER";
    public static final String NO_AGENT = "NO_AGENT";
    public static final String SESSION_NOT_WAITING = "SESSION_NOT_WAITING";
    public static final String UNSUPPORTED_DIRECTION = "UNSUPPORTED_DIRECTION";

    public ProtocolException(String code, String message) {
        super(code, message);
    }
}
