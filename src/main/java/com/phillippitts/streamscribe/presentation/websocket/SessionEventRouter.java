package com.phillippitts.streamscribe.presentation.websocket;

import com.phillippitts.streamscribe.exception.ProtocolException;
import com.phillippitts.streamscribe.presentation.protocol.InboundMessage;
import com.phillippitts.streamscribe.presentation.protocol.InboundMessageParser;
import com.phillippitts.streamscribe.service.ingest.OutboundMessages;
import com.phillippitts.streamscribe.service.ingest.SessionOutbound;
import com.phillippitts.streamscribe.service.ingest.SessionRegistry;
import com.phillippitts.streamscribe.service.ingest.SessionStateMachine;
import com.phillippitts.streamscribe.service.ingest.SessionWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Routes connection lifecycle and inbound frames to the owning {@link SessionStateMachine}.
 *
 * <p>Parsing happens on the transport thread; every state machine call is queued on the
 * session's {@link SessionWorker}, so one session's events are handled strictly in arrival
 * order while different sessions proceed in parallel.
 */
@Component
public class SessionEventRouter {

    private static final Logger LOG = LogManager.getLogger(SessionEventRouter.class);

    private static final DateTimeFormatter SESSION_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final SessionRegistry registry;
    private final InboundMessageParser parser;
    private final Executor sessionExecutor;
    private final Clock clock;

    public SessionEventRouter(SessionRegistry registry,
                              InboundMessageParser parser,
                              @Qualifier("sessionExecutor") Executor sessionExecutor,
                              Clock clock) {
        this.registry = registry;
        this.parser = parser;
        this.sessionExecutor = sessionExecutor;
        this.clock = clock;
    }

    /**
     * Creates the session for a new connection and queues the {@code connection} greeting.
     *
     * @param connectionId transport-level id, unique per connection
     * @return handle the transport keeps for later events
     */
    SessionHandle open(String connectionId, SessionOutbound outbound) {
        String sessionId = "session_" + SESSION_ID_FORMAT.format(clock.instant()) + "_" + connectionId;
        registry.create(sessionId, outbound);
        SessionWorker worker = new SessionWorker(sessionId, sessionExecutor);
        worker.submit(() -> outbound.send(OutboundMessages.connection(sessionId, clock.instant())));
        LOG.info("Session {} opened", sessionId);
        return new SessionHandle(sessionId, worker);
    }

    void onMessage(SessionHandle handle, String payload) {
        InboundMessage message;
        try {
            message = parser.parse(payload);
        } catch (ProtocolException e) {
            LOG.debug("Rejected frame for {}: {}", handle.sessionId(), e.getMessage());
            handle.worker().submit(() -> withSession(handle).ifPresent(m -> m.reportError(e.getMessage())));
            return;
        }
        handle.worker().submit(() -> withSession(handle).ifPresent(m -> dispatch(m, message)));
    }

    void onDisconnect(SessionHandle handle) {
        handle.worker().submit(() -> withSession(handle).ifPresent(SessionStateMachine::onDisconnect));
    }

    private void dispatch(SessionStateMachine machine, InboundMessage message) {
        try {
            switch (message.type()) {
                case InboundMessage.AUDIO_CHUNK -> machine.onChunk(message.chunk());
                case InboundMessage.START_RECORDING -> machine.onStartRecording(message.language());
                case InboundMessage.END_RECORDING -> machine.onEndRecording();
                default -> machine.onControl(message.type());
            }
        } catch (ProtocolException e) {
            machine.reportError(e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Failed to handle {} for session {}", message.type(), machine.getSessionId(), e);
            machine.reportError("Server error: " + e.getMessage());
        }
    }

    private Optional<SessionStateMachine> withSession(SessionHandle handle) {
        Optional<SessionStateMachine> machine = registry.get(handle.sessionId());
        if (machine.isEmpty()) {
            LOG.debug("Ignoring event for unknown session {}", handle.sessionId());
        }
        return machine;
    }
}
