package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.SessionState;
import com.phillippitts.streamscribe.service.archive.ObjectStore;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.audio.WavContainer;
import com.phillippitts.streamscribe.service.codec.PcmDecoder;
import com.phillippitts.streamscribe.service.events.ArchivalFailedEvent;
import com.phillippitts.streamscribe.service.metrics.IngestMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ends a session exactly once.
 *
 * <p>Steps, each isolated so a failure in one never skips the rest:
 * <ol>
 *   <li>Run one last batch if chunks are pending</li>
 *   <li>Send {@code recording_complete} and close the connection if it is still open</li>
 *   <li>Claim the one-time archival right; a second finalization stops here</li>
 *   <li>Build the full-session container (re-decoded for streaming sessions); nothing to archive
 *       if it is empty</li>
 *   <li>Hand it to the object store on the archive executor, so teardown never waits for storage</li>
 *   <li>Deregister the session and mark it {@code CLOSED}, whatever happened above</li>
 * </ol>
 */
@Component
public class SessionFinalizer {

    private static final Logger LOG = LogManager.getLogger(SessionFinalizer.class);

    private final BatchProcessor batchProcessor;
    private final PcmDecoder decoder;
    private final ObjectStore objectStore;
    private final Executor archiveExecutor;
    private final IngestMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public SessionFinalizer(BatchProcessor batchProcessor,
                            PcmDecoder decoder,
                            ObjectStore objectStore,
                            @Qualifier("archiveExecutor") Executor archiveExecutor,
                            IngestMetrics metrics,
                            ApplicationEventPublisher publisher,
                            Clock clock) {
        this.batchProcessor = Objects.requireNonNull(batchProcessor, "batchProcessor");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
        this.archiveExecutor = Objects.requireNonNull(archiveExecutor, "archiveExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param onClosed deregisters the session; always invoked
     */
    public void finalizeSession(AudioSession session, SessionOutbound outbound, Runnable onClosed) {
        String sessionId = session.getSessionId();
        try {
            drainPendingBatch(session, outbound);
            announceCompletion(session, outbound);

            if (!session.markFinalized()) {
                LOG.debug("Session {} already finalized; skipping archival", sessionId);
                return;
            }
            byte[] container = buildFullContainer(session);
            if (container == null) {
                metrics.archive("skipped");
                return;
            }
            dispatchArchival(sessionId, container, archiveMetadata(session, container));
        } finally {
            try {
                onClosed.run();
            } finally {
                session.setState(SessionState.CLOSED);
                LOG.info("Session {} closed", sessionId);
            }
        }
    }

    private void drainPendingBatch(AudioSession session, SessionOutbound outbound) {
        if (session.pendingChunkCount() == 0) {
            return;
        }
        try {
            BatchOutcome outcome = batchProcessor.process(session, outbound);
            LOG.debug("Final batch for session {}: {}", session.getSessionId(), outcome);
        } catch (RuntimeException e) {
            LOG.warn("Final batch for session {} failed unexpectedly", session.getSessionId(), e);
        }
    }

    private void announceCompletion(AudioSession session, SessionOutbound outbound) {
        try {
            if (outbound.isOpen()) {
                outbound.send(OutboundMessages.recordingComplete(session.getTotalChunkCount(), clock.instant()));
                outbound.close();
            }
        } catch (RuntimeException e) {
            LOG.warn("Could not send completion to session {}: {}", session.getSessionId(), e.toString());
        }
    }

    /**
     * @return the canonical container of the whole session, or {@code null} if there is nothing to archive
     */
    private byte[] buildFullContainer(AudioSession session) {
        SessionAudioBuffer buffer = session.getBuffer();
        if (buffer == null) {
            LOG.debug("Session {} received no audio; nothing to archive", session.getSessionId());
            return null;
        }
        byte[] pcm;
        try {
            pcm = buffer.fullSessionPcm(decoder);
        } catch (RuntimeException e) {
            LOG.warn("Could not rebuild full audio for session {}: {}", session.getSessionId(), e.getMessage());
            publisher.publishEvent(new ArchivalFailedEvent(session.getSessionId(),
                    "full-session decode failed: " + e.getMessage(), clock.instant()));
            return null;
        }
        if (pcm.length == 0) {
            LOG.debug("Session {} produced no PCM; nothing to archive", session.getSessionId());
            return null;
        }
        return WavContainer.wrap(pcm);
    }

    private Map<String, String> archiveMetadata(AudioSession session, byte[] container) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("language", session.getLanguage());
        metadata.put("source_format", session.getSourceFormat().name());
        metadata.put("mime_type", String.valueOf(session.getDeclaredMimeType()));
        metadata.put("total_chunks", String.valueOf(session.getTotalChunkCount()));
        metadata.put("start_time", session.getStartTime().toString());
        metadata.put("duration_seconds",
                String.valueOf(AudioFormat.durationSeconds(container.length - AudioFormat.WAV_HEADER_SIZE)));
        return metadata;
    }

    private void dispatchArchival(String sessionId, byte[] container, Map<String, String> metadata) {
        try {
            archiveExecutor.execute(() -> archive(sessionId, container, metadata));
        } catch (RejectedExecutionException e) {
            LOG.error("Archive executor rejected session {}", sessionId, e);
            archivalFailed(sessionId, "archive executor rejected task: " + e.getMessage());
        }
    }

    private void archive(String sessionId, byte[] container, Map<String, String> metadata) {
        try {
            Optional<String> handle = objectStore.store(sessionId, container, metadata);
            if (handle.isPresent()) {
                metrics.archive("stored");
                LOG.info("Session {} archived as {}", sessionId, handle.get());
            } else {
                metrics.archive("skipped");
                LOG.debug("Session {} not archived: object store not configured", sessionId);
            }
        } catch (RuntimeException e) {
            LOG.error("Archival failed for session {}", sessionId, e);
            archivalFailed(sessionId, e.getMessage());
        }
    }

    private void archivalFailed(String sessionId, String reason) {
        metrics.archive("failed");
        publisher.publishEvent(new ArchivalFailedEvent(sessionId, reason, clock.instant()));
    }
}
