package com.agentmanager.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link GatewayConnection} over a Spring {@link WebSocketSession}. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator} so the gateway can write from any thread.
 */
class WebSocketGatewayConnection implements GatewayConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketGatewayConnection.class);

    private final WebSocketSession session;

    WebSocketGatewayConnection(WebSocketSession session, int sendTimeLimitMs, int sendBufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void close(String reason) {
        try {
            session.close(CloseStatus.POLICY_VIOLATION.withReason(reason));
        } catch (IOException e) {
            log.debug("Failed to close connection {}: {}", id(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
