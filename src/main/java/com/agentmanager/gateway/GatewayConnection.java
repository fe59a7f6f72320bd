package com.agentmanager.gateway;

import java.io.IOException;

/**
 * A live client or agent connection, independent of the transport carrying it.
 */
public interface GatewayConnection {

    String id();

    /**
     * Sends one text frame. Implementations must be safe for concurrent callers.
     */
    void send(String frame) throws IOException;

    void close(String reason);

    boolean isOpen();
}
