package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.config.properties.BatchingProperties;
import com.phillippitts.streamscribe.domain.ChunkMeta;
import com.phillippitts.streamscribe.domain.SessionState;
import com.phillippitts.streamscribe.service.audio.WavContainer;
import com.phillippitts.streamscribe.service.events.ArchivalFailedEvent;
import com.phillippitts.streamscribe.testutil.RecordingObjectStore;
import com.phillippitts.streamscribe.testutil.RecordingOutbound;
import com.phillippitts.streamscribe.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.streamscribe.service.ingest.SessionFixture.WAV_MIME;
import static com.phillippitts.streamscribe.service.ingest.SessionFixture.WEBM_MIME;
import static com.phillippitts.streamscribe.service.ingest.SessionFixture.chunk;
import static org.assertj.core.api.Assertions.assertThat;

class SessionFinalizerTest {

    private static final BatchingProperties DEFAULT_BATCHING = new BatchingProperties(5, 20, 5);

    @Test
    void shouldStoreExactlyOnceWhenFinalizedTwice() {
        // Arrange
        SessionFixture f = new SessionFixture();
        SessionStateMachine machine = f.newMachine("s1");
        machine.onChunk(chunk(1, WAV_MIME, 320));
        AtomicInteger removed = new AtomicInteger();

        // Act
        f.finalizer.finalizeSession(machine.getSession(), f.outbound, removed::incrementAndGet);
        f.finalizer.finalizeSession(machine.getSession(), f.outbound, removed::incrementAndGet);

        // Assert
        assertThat(f.store.stored()).hasSize(1);
        assertThat(removed).hasValue(2);
        assertThat(machine.getSession().isFinalized()).isTrue();
    }

    @Test
    void shouldDrainPendingChunksBeforeCompletionNotice() {
        SessionFixture f = new SessionFixture();
        SessionStateMachine machine = f.newMachine("s1");
        machine.onChunk(chunk(1, WAV_MIME, 320));
        machine.onChunk(chunk(2, WAV_MIME, 320));

        machine.onEndRecording();

        assertThat(f.oracle.callCount()).isEqualTo(1);
        assertThat(f.outbound.types()).containsSubsequence(
                OutboundMessages.BATCH_PROCESSING, OutboundMessages.BATCH_TRANSCRIPTION, OutboundMessages.RECORDING_COMPLETE);
        OutboundMessage complete = f.outbound.last();
        assertThat(complete.get("total_chunks_processed")).isEqualTo(2L);
        assertThat(complete.get("message")).isEqualTo("Recording session completed");
        assertThat(f.outbound.closeCount()).isEqualTo(1);
    }

    @Test
    void shouldArchiveFullSessionAudioWithMetadata() {
        SessionFixture f = new SessionFixture();
        SessionStateMachine machine = f.newMachine("s1");
        machine.onStartRecording("de");
        for (int seq = 1; seq <= 7; seq++) {
            machine.onChunk(chunk(seq, WAV_MIME, 3200));
        }

        machine.onEndRecording();

        RecordingObjectStore.Stored stored = f.store.stored().get(0);
        assertThat(stored.sessionId()).isEqualTo("s1");
        assertThat(WavContainer.unwrap(stored.wav())).hasSize(7 * 3200);
        Map<String, String> md = stored.metadata();
        assertThat(md).containsEntry("language", "de")
                .containsEntry("source_format", "RAW_PCM_CONTAINER")
                .containsEntry("mime_type", WAV_MIME)
                .containsEntry("total_chunks", "7")
                .containsEntry("start_time", "2024-05-01T10:15:30Z")
                .containsEntry("duration_seconds", "0.7");
        assertThat(f.counter("streamscribe.archive", "outcome", "stored")).isEqualTo(1.0);
    }

    @Test
    void shouldArchiveStreamingSessionFromFullRedecode() {
        SessionFixture f = new SessionFixture();
        SessionStateMachine machine = f.newMachine("s1");
        machine.onChunk(chunk(1, WEBM_MIME, 500));
        machine.onChunk(chunk(2, WEBM_MIME, 500));

        machine.onDisconnect();

        assertThat(WavContainer.unwrap(f.store.stored().get(0).wav())).hasSize(1000);
        assertThat(f.store.stored().get(0).metadata()).containsEntry("source_format", "STREAMING_CONTAINER");
    }

    @Test
    void shouldSkipArchivalForSessionWithoutAudio() {
        SessionFixture f = new SessionFixture();
        SessionStateMachine machine = f.newMachine("s1");

        machine.onEndRecording();

        assertThat(f.store.stored()).isEmpty();
        assertThat(f.counter("streamscribe.archive", "outcome", "skipped")).isEqualTo(1.0);
        assertThat(f.closedCalls).hasValue(1);
    }

    @Test
    void shouldRemoveSessionWhenEveryStepFails() {
        // Arrange: both outbound and store fail
        RecordingOutbound brokenOutbound = new RecordingOutbound() {
            @Override
            public void send(OutboundMessage message) {
                throw new IllegalStateException("socket gone");
            }
        };
        SessionFixture f = new SessionFixture(DEFAULT_BATCHING, new RecordingObjectStore().failing(), new SyncExecutor());
        AudioSession session = new AudioSession("s1", f.clock.instant(), "en");
        session.bufferFor(WAV_MIME).append(new byte[320]);
        session.addChunk(new ChunkMeta(1, null, WAV_MIME, 320));
        session.setState(SessionState.FINALIZING);
        AtomicInteger removed = new AtomicInteger();

        // Act
        f.finalizer.finalizeSession(session, brokenOutbound, removed::incrementAndGet);

        // Assert
        assertThat(removed).hasValue(1);
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(f.publisher.eventsOf(ArchivalFailedEvent.class)).hasSize(1);
        assertThat(f.counter("streamscribe.archive", "outcome", "failed")).isEqualTo(1.0);
    }

    @Test
    void shouldPublishArchivalFailureWhenFullRedecodeFails() {
        SessionFixture f = new SessionFixture();
        SessionStateMachine machine = f.newMachine("s1");
        machine.onChunk(chunk(1, WEBM_MIME, 500));
        f.codec.failAlways();

        machine.onEndRecording();

        assertThat(f.store.stored()).isEmpty();
        assertThat(f.publisher.eventsOf(ArchivalFailedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.reason()).startsWith("full-session decode failed"));
        assertThat(f.closedCalls).hasValue(1);
    }

    @Test
    void shouldNotArchiveWhenExecutorRejects() {
        SessionFixture f = new SessionFixture(DEFAULT_BATCHING, new RecordingObjectStore(), task -> {
            throw new RejectedExecutionException("shutting down");
        });
        SessionStateMachine machine = f.newMachine("s1");
        machine.onChunk(chunk(1, WAV_MIME, 320));

        machine.onEndRecording();

        assertThat(f.store.stored()).isEmpty();
        assertThat(f.publisher.eventsOf(ArchivalFailedEvent.class)).hasSize(1);
        assertThat(machine.getSession().getState()).isEqualTo(SessionState.CLOSED);
        assertThat(f.closedCalls).hasValue(1);
    }
}
