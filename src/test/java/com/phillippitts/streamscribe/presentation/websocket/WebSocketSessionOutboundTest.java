package com.phillippitts.streamscribe.presentation.websocket;

import com.phillippitts.streamscribe.service.ingest.OutboundMessages;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketSessionOutboundTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final WebSocketSession session = mock(WebSocketSession.class);
    private final WebSocketSessionOutbound outbound = new WebSocketSessionOutbound(session);

    @Test
    void sendsMessageAsJsonTextFrame() throws Exception {
        when(session.isOpen()).thenReturn(true);

        outbound.send(OutboundMessages.pong(NOW));

        ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(frame.capture());
        assertThat(frame.getValue().getPayload())
                .contains("\"type\":\"pong\"")
                .contains("\"timestamp\":\"2024-05-01T10:15:30Z\"");
    }

    @Test
    void dropsMessagesAfterConnectionClosed() throws Exception {
        when(session.isOpen()).thenReturn(false);

        outbound.send(OutboundMessages.pong(NOW));
        outbound.close();

        verify(session, never()).sendMessage(any());
        verify(session, never()).close(any());
    }

    @Test
    void sendFailureDoesNotPropagate() throws Exception {
        when(session.isOpen()).thenReturn(true);
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());

        assertThatCode(() -> outbound.send(OutboundMessages.pong(NOW))).doesNotThrowAnyException();
    }

    @Test
    void closesWithNormalStatus() throws Exception {
        when(session.isOpen()).thenReturn(true);

        outbound.close();

        verify(session).close(CloseStatus.NORMAL);
    }
}
