package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.domain.TranscriptionResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for every message the server sends.
 */
public final class OutboundMessages {

    public static final String CONNECTION = "connection";
    public static final String AUDIO_ACK = "audio_ack";
    public static final String BATCH_PROCESSING = "batch_processing";
    public static final String BATCH_TRANSCRIPTION = "batch_transcription";
    public static final String RECORDING_COMPLETE = "recording_complete";
    public static final String ERROR = "error";
    public static final String PONG = "pong";
    public static final String RECORDING_STARTED = "recording_started";
    public static final String RECORDING_STOPPED = "recording_stopped";
    public static final String UNKNOWN_MESSAGE = "unknown_message";

    private OutboundMessages() {}

    public static OutboundMessage connection(String sessionId, Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message", "WebSocket connected successfully");
        f.put("session_id", sessionId);
        f.put("timestamp", now.toString());
        return new OutboundMessage(CONNECTION, f);
    }

    /**
     * @param clientTimestamp the chunk's own timestamp, echoed back
     * @param batchSize       chunks pending in the current batch, this one included
     */
    public static OutboundMessage audioAck(Integer sequenceNumber, String clientTimestamp, int batchSize, Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("sequenceNumber", sequenceNumber);
        f.put("timestamp", clientTimestamp);
        f.put("message", "Audio chunk received");
        f.put("processed_at", now.toString());
        f.put("batch_size", batchSize);
        return new OutboundMessage(AUDIO_ACK, f);
    }

    public static OutboundMessage batchProcessing(int chunkCount, int bytes, Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message", "Processing batch of " + chunkCount + " chunks (" + bytes + " bytes)");
        f.put("timestamp", now.toString());
        return new OutboundMessage(BATCH_PROCESSING, f);
    }

    public static OutboundMessage batchTranscription(TranscriptionResult result, int chunkCount,
                                                     double durationSeconds, Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("text", result.text());
        f.put("confidence", result.confidence());
        f.put("chunk_count", chunkCount);
        f.put("duration_seconds", durationSeconds);
        f.put("timestamp", now.toString());
        f.put("ready_for_llm", true);
        return new OutboundMessage(BATCH_TRANSCRIPTION, f);
    }

    public static OutboundMessage recordingComplete(long totalChunks, Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message", "Recording session completed");
        f.put("total_chunks_processed", totalChunks);
        f.put("timestamp", now.toString());
        return new OutboundMessage(RECORDING_COMPLETE, f);
    }

    public static OutboundMessage error(String message, Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message", message);
        f.put("timestamp", now.toString());
        return new OutboundMessage(ERROR, f);
    }

    public static OutboundMessage pong(Instant now) {
        return new OutboundMessage(PONG, Map.of("timestamp", now.toString()));
    }

    public static OutboundMessage recordingStarted(String language, Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message", "Recording session started");
        f.put("language", language);
        f.put("timestamp", now.toString());
        return new OutboundMessage(RECORDING_STARTED, f);
    }

    public static OutboundMessage recordingStopped(Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message", "Recording session stopped");
        f.put("timestamp", now.toString());
        return new OutboundMessage(RECORDING_STOPPED, f);
    }

    public static OutboundMessage unknownMessage(String type, Instant now) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message", "Unknown message type: " + type);
        f.put("timestamp", now.toString());
        return new OutboundMessage(UNKNOWN_MESSAGE, f);
    }
}
