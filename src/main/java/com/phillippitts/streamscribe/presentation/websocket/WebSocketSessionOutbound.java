package com.phillippitts.streamscribe.presentation.websocket;

import com.phillippitts.streamscribe.service.ingest.OutboundMessage;
import com.phillippitts.streamscribe.service.ingest.SessionOutbound;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link SessionOutbound} over a Spring {@link WebSocketSession}.
 *
 * <p>The wrapped session should be a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator} so sends
 * from the session worker and the finalizer never interleave.
 */
final class WebSocketSessionOutbound implements SessionOutbound {

    private static final Logger LOG = LogManager.getLogger(WebSocketSessionOutbound.class);

    private final WebSocketSession session;

    WebSocketSessionOutbound(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public void send(OutboundMessage message) {
        if (!session.isOpen()) {
            LOG.debug("Dropping {} for closed connection {}", message.type(), session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(message.toJson()));
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send {} to connection {}: {}", message.type(), session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            LOG.warn("Failed to close connection {}: {}", session.getId(), e.getMessage());
        }
    }
}
