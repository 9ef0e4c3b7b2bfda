package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.ChunkMeta;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.audio.WavContainer;
import com.phillippitts.streamscribe.service.events.DecodeFailedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.phillippitts.streamscribe.service.ingest.SessionFixture.WAV_MIME;
import static com.phillippitts.streamscribe.service.ingest.SessionFixture.WEBM_MIME;
import static org.assertj.core.api.Assertions.assertThat;

class BatchProcessorTest {

    private SessionFixture f;
    private AudioSession session;

    @BeforeEach
    void setUp() {
        f = new SessionFixture();
        session = new AudioSession("s1", f.clock.instant(), "en");
    }

    private void accept(String mime, byte[] bytes) {
        session.bufferFor(mime).append(bytes);
        session.addChunk(new ChunkMeta((int) session.getTotalChunkCount() + 1, null, mime, bytes.length));
    }

    @Test
    void shouldSkipWhenSessionHasNoAudio() {
        BatchOutcome outcome = f.processor.process(session, f.outbound);

        assertThat(outcome).isEqualTo(BatchOutcome.SKIPPED);
        assertThat(f.oracle.callCount()).isZero();
        assertThat(f.outbound.sent()).isEmpty();
    }

    @Test
    void shouldNotCallOracleWhenNoNewPcmSinceLastBatch() {
        // Arrange
        accept(WAV_MIME, new byte[640]);
        assertThat(f.processor.process(session, f.outbound)).isEqualTo(BatchOutcome.TRANSCRIBED);
        f.outbound.clear();
        f.clock.advance(Duration.ofSeconds(10));

        // Act
        BatchOutcome outcome = f.processor.process(session, f.outbound);

        // Assert
        assertThat(outcome).isEqualTo(BatchOutcome.SKIPPED);
        assertThat(f.oracle.callCount()).isEqualTo(1);
        assertThat(f.outbound.ofType(OutboundMessages.BATCH_TRANSCRIPTION)).isEmpty();
        assertThat(f.counter("streamscribe.batches", "outcome", "skipped")).isEqualTo(1.0);
    }

    @Test
    void shouldSkipStreamingBatchWhenRedecodeIsNotLongerThanOffsetAndKeepChunks() {
        accept(WEBM_MIME, new byte[400]);
        f.processor.process(session, f.outbound);
        // chunk recorded, but the re-decode yields no PCM past the processed offset
        session.addChunk(new ChunkMeta(2, null, WEBM_MIME, 0));

        BatchOutcome outcome = f.processor.process(session, f.outbound);

        assertThat(outcome).isEqualTo(BatchOutcome.SKIPPED);
        assertThat(session.pendingChunkCount()).isEqualTo(1);
        assertThat(((ContainerAccumulator) session.getBuffer()).processedPcmOffset()).isEqualTo(400);
    }

    @Test
    void shouldReportProgressThenTranscriptionWithDuration() {
        accept(WAV_MIME, new byte[AudioFormat.REQUIRED_BYTE_RATE]);
        accept(WAV_MIME, new byte[AudioFormat.REQUIRED_BYTE_RATE / 2]);

        f.processor.process(session, f.outbound);

        assertThat(f.outbound.types()).containsExactly(
                OutboundMessages.BATCH_PROCESSING, OutboundMessages.BATCH_TRANSCRIPTION);
        assertThat(f.outbound.sent().get(0).get("message"))
                .isEqualTo("Processing batch of 2 chunks (48000 bytes)");
        OutboundMessage result = f.outbound.sent().get(1);
        assertThat(result.get("text")).isEqualTo("batch 1");
        assertThat(result.get("confidence")).isEqualTo(0.95);
        assertThat(result.get("duration_seconds")).isEqualTo(1.5);
        assertThat(WavContainer.unwrap(f.oracle.calls().get(0).wav())).hasSize(48000);
    }

    @Test
    void shouldKeepOffsetsWhenStreamingDecodeFails() {
        // Arrange
        accept(WEBM_MIME, new byte[400]);
        f.codec.failAlways();

        // Act
        BatchOutcome outcome = f.processor.process(session, f.outbound);

        // Assert
        assertThat(outcome).isEqualTo(BatchOutcome.FAILED);
        assertThat(f.oracle.callCount()).isZero();
        assertThat(session.pendingChunkCount()).isEqualTo(1);
        assertThat(((ContainerAccumulator) session.getBuffer()).processedPcmOffset()).isZero();
        assertThat(f.outbound.last().type()).isEqualTo(OutboundMessages.ERROR);
        assertThat(f.publisher.eventsOf(DecodeFailedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.isBatchLevel()).isTrue());

        f.codec.failWhen((source, hint) -> false);
        assertThat(f.processor.process(session, f.outbound)).isEqualTo(BatchOutcome.TRANSCRIBED);
        assertThat(((ContainerAccumulator) session.getBuffer()).processedPcmOffset()).isEqualTo(400);
    }
}
