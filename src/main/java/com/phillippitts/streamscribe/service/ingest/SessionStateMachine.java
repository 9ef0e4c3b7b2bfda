package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.ChunkMeta;
import com.phillippitts.streamscribe.domain.SessionState;
import com.phillippitts.streamscribe.exception.DecodeException;
import com.phillippitts.streamscribe.service.codec.DecodeResult;
import com.phillippitts.streamscribe.service.codec.PcmDecoder;
import com.phillippitts.streamscribe.service.events.DecodeFailedEvent;
import com.phillippitts.streamscribe.service.metrics.IngestMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Drives one session through {@code ACTIVE -> FINALIZING -> CLOSED}.
 *
 * <p>Every method must be called from the session's worker, one at a time, in arrival order.
 * That ordering is what makes the session's buffers safe without locks.
 *
 * <p>Chunk handling while {@code ACTIVE}:
 * <ol>
 *   <li>The first chunk fixes the source format and creates the matching buffer</li>
 *   <li>Self-delimited chunks are decoded now (hinted by the chunk's own mime type, then one
 *       auto-detect retry); streaming chunks are appended raw</li>
 *   <li>Metadata is recorded, the chunk is acknowledged, the trigger policy is evaluated</li>
 * </ol>
 * A chunk that cannot be decoded is reported and otherwise ignored: counters, metadata and
 * buffers stay as they were and the trigger is not evaluated.
 */
public class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);

    /**
     * Collaborators shared by every session.
     */
    public record Dependencies(
            PcmDecoder decoder,
            BatchTriggerPolicy triggerPolicy,
            BatchProcessor batchProcessor,
            SessionFinalizer finalizer,
            IngestMetrics metrics,
            ApplicationEventPublisher publisher,
            Clock clock
    ) {}

    private final AudioSession session;
    private final SessionOutbound outbound;
    private final Dependencies deps;
    private final Runnable onClosed;

    /**
     * @param onClosed invoked exactly once when the session is finalized, to deregister it
     */
    public SessionStateMachine(AudioSession session, SessionOutbound outbound, Dependencies deps, Runnable onClosed) {
        this.session = Objects.requireNonNull(session, "session");
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        this.deps = Objects.requireNonNull(deps, "deps");
        this.onClosed = Objects.requireNonNull(onClosed, "onClosed");
    }

    public void onChunk(AudioChunk chunk) {
        if (!acceptsEvents("audio_chunk")) {
            return;
        }
        SessionAudioBuffer buffer = session.bufferFor(chunk.mimeType());
        int decodedBytes = 0;
        if (buffer.decodesOnArrival()) {
            DecodeResult decoded = deps.decoder().decode(chunk.data(), chunk.mimeType());
            if (!decoded.isSuccess()) {
                rejectChunk(chunk, decoded.error());
                return;
            }
            byte[] pcm = decoded.pcm();
            buffer.append(pcm);
            decodedBytes = pcm.length;
        } else {
            buffer.append(chunk.data());
        }

        session.addChunk(new ChunkMeta(chunk.sequenceOrUnknown(), chunk.timestamp(), chunk.mimeType(), decodedBytes));
        deps.metrics().chunkAccepted(buffer.format().name());
        LOG.debug("Session {} chunk {}: {}B in, {}B PCM, {} pending",
                session.getSessionId(), chunk.sequenceNumber(), chunk.data().length, decodedBytes,
                session.pendingChunkCount());

        Instant now = deps.clock().instant();
        outbound.send(OutboundMessages.audioAck(chunk.sequenceNumber(), chunk.timestamp(),
                session.pendingChunkCount(), now));

        if (deps.triggerPolicy().shouldTrigger(session.pendingChunkCount(), session.getLastBatchTime(), now)) {
            deps.batchProcessor().process(session, outbound);
        }
    }

    private void rejectChunk(AudioChunk chunk, DecodeException error) {
        LOG.warn("Session {} could not decode chunk {} ({}B, {}): {}",
                session.getSessionId(), chunk.sequenceNumber(), chunk.data().length, chunk.mimeType(),
                error.getMessage());
        deps.metrics().chunkDecodeFailed();
        deps.publisher().publishEvent(new DecodeFailedEvent(session.getSessionId(), chunk.sequenceOrUnknown(),
                error.getFormatHint(), error.getMessage(), deps.clock().instant()));
        outbound.send(OutboundMessages.error("Failed to process audio chunk " + chunk.sequenceNumber()
                + ": " + error.getMessage(), deps.clock().instant()));
    }

    /**
     * Sets the session language; a blank or missing language keeps the current one.
     */
    public void onStartRecording(String language) {
        if (!acceptsEvents("start_recording")) {
            return;
        }
        if (language != null && !language.isBlank()) {
            session.setLanguage(language.trim());
        }
        LOG.info("Session {} recording started (language={})", session.getSessionId(), session.getLanguage());
        outbound.send(OutboundMessages.recordingStarted(session.getLanguage(), deps.clock().instant()));
    }

    /**
     * Answers control messages that do not change session state. Unknown types get an
     * {@code unknown_message} reply, not an error.
     */
    public void onControl(String type) {
        if (!acceptsEvents(type)) {
            return;
        }
        Instant now = deps.clock().instant();
        OutboundMessage reply = switch (type == null ? "" : type) {
            case "ping" -> OutboundMessages.pong(now);
            case "stop_recording" -> OutboundMessages.recordingStopped(now);
            default -> OutboundMessages.unknownMessage(type, now);
        };
        outbound.send(reply);
    }

    public void onEndRecording() {
        beginFinalizing("end_recording");
    }

    public void onDisconnect() {
        beginFinalizing("disconnect");
    }

    /**
     * Reports an error that is not tied to a chunk or batch (malformed message, unexpected failure).
     */
    public void reportError(String message) {
        if (session.getState() == SessionState.ACTIVE) {
            outbound.send(OutboundMessages.error(message, deps.clock().instant()));
        }
    }

    private void beginFinalizing(String reason) {
        if (!acceptsEvents(reason)) {
            return;
        }
        LOG.info("Session {} finalizing on {} ({} chunks total, {} pending)",
                session.getSessionId(), reason, session.getTotalChunkCount(), session.pendingChunkCount());
        session.setState(SessionState.FINALIZING);
        deps.finalizer().finalizeSession(session, outbound, onClosed);
    }

    private boolean acceptsEvents(String event) {
        if (session.getState() != SessionState.ACTIVE) {
            LOG.debug("Session {} is {}; ignoring {}", session.getSessionId(), session.getState(), event);
            return false;
        }
        return true;
    }

    public AudioSession getSession() {
        return session;
    }

    public String getSessionId() {
        return session.getSessionId();
    }
}
