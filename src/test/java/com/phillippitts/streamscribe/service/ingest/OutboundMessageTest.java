package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.TranscriptionResult;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class OutboundMessageTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Test
    void ackSerializesMissingClientFieldsAsNull() {
        JSONObject json = new JSONObject(OutboundMessages.audioAck(null, null, 3, NOW).toJson());

        assertThat(json.getString("type")).isEqualTo("audio_ack");
        assertThat(json.isNull("sequenceNumber")).isTrue();
        assertThat(json.isNull("timestamp")).isTrue();
        assertThat(json.getString("processed_at")).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(json.getInt("batch_size")).isEqualTo(3);
    }

    @Test
    void batchTranscriptionCarriesResultFields() {
        TranscriptionResult result = new TranscriptionResult("hello", 0.95, "en", NOW, "fake");

        OutboundMessage msg = OutboundMessages.batchTranscription(result, 5, 1.5, NOW);
        JSONObject json = new JSONObject(msg.toJson());

        assertThat(json.getString("text")).isEqualTo("hello");
        assertThat(json.getDouble("confidence")).isEqualTo(0.95);
        assertThat(json.getInt("chunk_count")).isEqualTo(5);
        assertThat(json.getDouble("duration_seconds")).isEqualTo(1.5);
        assertThat(json.getBoolean("ready_for_llm")).isTrue();
    }

    @Test
    void controlRepliesHaveExpectedTypes() {
        assertThat(OutboundMessages.pong(NOW).type()).isEqualTo("pong");
        assertThat(OutboundMessages.recordingStarted("fr", NOW).get("language")).isEqualTo("fr");
        assertThat(OutboundMessages.recordingStopped(NOW).type()).isEqualTo("recording_stopped");
        assertThat(OutboundMessages.unknownMessage("subscribe", NOW).get("message"))
                .isEqualTo("Unknown message type: subscribe");
        assertThat(OutboundMessages.batchProcessing(5, 48000, NOW).get("message"))
                .isEqualTo("Processing batch of 5 chunks (48000 bytes)");
    }
}
