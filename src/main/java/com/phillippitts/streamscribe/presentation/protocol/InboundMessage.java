package com.phillippitts.streamscribe.presentation.protocol;

import com.phillippitts.streamscribe.service.ingest.AudioChunk;

/**
 * A parsed client message.
 *
 * @param type     message type as sent by the client
 * @param chunk    audio payload, only for {@link #AUDIO_CHUNK}
 * @param language requested language, only for {@link #START_RECORDING} (may be null)
 */
public record InboundMessage(String type, AudioChunk chunk, String language) {

    public static final String AUDIO_CHUNK = "audio_chunk";
    public static final String START_RECORDING = "start_recording";
    public static final String END_RECORDING = "end_recording";

    public static InboundMessage audio(AudioChunk chunk) {
        return new InboundMessage(AUDIO_CHUNK, chunk, null);
    }

    public static InboundMessage startRecording(String language) {
        return new InboundMessage(START_RECORDING, null, language);
    }

    public static InboundMessage control(String type) {
        return new InboundMessage(type, null, null);
    }
}
