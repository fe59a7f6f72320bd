package com.agentmanager.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Bridges Spring's WebSocket callbacks to {@link SessionGateway}.
 */
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayWebSocketHandler.class);

    private final SessionGateway gateway;
    private final GatewayProperties properties;

    public GatewayWebSocketHandler(SessionGateway gateway, GatewayProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        gateway.onOpen(new WebSocketGatewayConnection(session,
                properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        gateway.onFrame(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        gateway.onClose(session.getId());
    }
}
