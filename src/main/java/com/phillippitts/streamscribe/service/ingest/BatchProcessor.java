package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.TranscriptionResult;
import com.phillippitts.streamscribe.exception.DecodeException;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.events.DecodeFailedEvent;
import com.phillippitts.streamscribe.service.metrics.IngestMetrics;
import com.phillippitts.streamscribe.service.transcription.TranscriptionOracle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one batch: package, transcribe, relay, commit.
 *
 * <p>Offsets and pending chunks advance only after the oracle succeeded. On a decode or
 * transcription failure the client gets an {@code error} message and the same audio is
 * offered again on the next trigger.
 */
@Component
public class BatchProcessor {

    private static final Logger LOG = LogManager.getLogger(BatchProcessor.class);

    private final BatchPackager packager;
    private final TranscriptionOracle oracle;
    private final IngestMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public BatchProcessor(BatchPackager packager,
                          TranscriptionOracle oracle,
                          IngestMetrics metrics,
                          ApplicationEventPublisher publisher,
                          Clock clock) {
        this.packager = Objects.requireNonNull(packager, "packager");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BatchOutcome process(AudioSession session, SessionOutbound outbound) {
        Optional<PackagedBatch> packed;
        try {
            packed = packager.pack(session);
        } catch (DecodeException e) {
            LOG.warn("Batch decode failed for session {} ({} pending chunks): {}",
                    session.getSessionId(), session.pendingChunkCount(), e.getMessage());
            publisher.publishEvent(new DecodeFailedEvent(session.getSessionId(), -1, e.getFormatHint(),
                    e.getMessage(), clock.instant()));
            return fail(outbound, e);
        }
        if (packed.isEmpty()) {
            LOG.debug("No new audio for session {}; {} chunks stay pending",
                    session.getSessionId(), session.pendingChunkCount());
            metrics.batch("skipped");
            return BatchOutcome.SKIPPED;
        }

        PackagedBatch batch = packed.get();
        LOG.info("Processing batch for session {}: {} chunks, {} PCM bytes ({}s)",
                session.getSessionId(), batch.chunkCount(), batch.pcmBytes(), batch.durationSeconds());
        outbound.send(OutboundMessages.batchProcessing(batch.chunkCount(), batch.pcmBytes(), clock.instant()));

        TranscriptionResult result;
        long startTime = System.nanoTime();
        try {
            result = oracle.transcribe(batch.container(), session.getLanguage());
        } catch (TranscriptionException e) {
            LOG.warn("Transcription failed for session {}: {}", session.getSessionId(), e.getMessage());
            return fail(outbound, e);
        }
        metrics.transcriptionLatency(oracle.getEngineName(), System.nanoTime() - startTime);

        Instant now = clock.instant();
        session.getBuffer().commit(batch.slice());
        session.completeBatch(now);
        outbound.send(OutboundMessages.batchTranscription(result, batch.chunkCount(), batch.durationSeconds(), now));
        metrics.batch("success");
        LOG.debug("Batch complete for session {} (chars={})", session.getSessionId(), result.text().length());
        return BatchOutcome.TRANSCRIBED;
    }

    private BatchOutcome fail(SessionOutbound outbound, RuntimeException e) {
        metrics.batch("failure");
        outbound.send(OutboundMessages.error("Batch processing failed: " + e.getMessage(), clock.instant()));
        return BatchOutcome.FAILED;
    }
}
