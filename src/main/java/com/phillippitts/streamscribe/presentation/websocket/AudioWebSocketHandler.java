package com.phillippitts.streamscribe.presentation.websocket;

import com.phillippitts.streamscribe.config.properties.IngestProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint for live audio. One connection is one ingestion session.
 */
@Component
public class AudioWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(AudioWebSocketHandler.class);

    private final SessionEventRouter router;
    private final IngestProperties properties;

    public AudioWebSocketHandler(SessionEventRouter router, IngestProperties properties) {
        this.router = router;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit());
        SessionHandle handle = router.open(session.getId(), new WebSocketSessionOutbound(concurrent));
        session.getAttributes().put(SessionHandle.ATTRIBUTE, handle);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SessionHandle handle = handleOf(session);
        if (handle == null) {
            LOG.warn("Text frame on connection {} without a session", session.getId());
            return;
        }
        router.onMessage(handle, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SessionHandle handle = handleOf(session);
        if (handle == null) {
            return;
        }
        LOG.info("Connection for session {} closed ({})", handle.sessionId(), status);
        router.onDisconnect(handle);
    }

    private static SessionHandle handleOf(WebSocketSession session) {
        return session.getAttributes().get(SessionHandle.ATTRIBUTE) instanceof SessionHandle h ? h : null;
    }
}
