package com.phillippitts.streamscribe.presentation.protocol;

import com.phillippitts.streamscribe.exception.ProtocolException;
import com.phillippitts.streamscribe.service.ingest.AudioChunk;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

/**
 * Parses client text frames.
 *
 * <p>Audio arrives as {@code {"type":"audio_chunk","data":[0..255,...],"timestamp":..,
 * "sequenceNumber":..,"mimeType":..}}; {@code mimeType} defaults to {@code audio/webm}.
 * Any other {@code type} is passed through as a control message.
 */
@Component
public class InboundMessageParser {

    /**
     * @throws ProtocolException if the frame is not a JSON object, has no type, or carries
     *                           malformed audio
     */
    public InboundMessage parse(String payload) {
        JSONObject json;
        try {
            json = new JSONObject(payload);
        } catch (JSONException e) {
            throw new ProtocolException("Invalid JSON format", e);
        }

        String type = json.optString("type", "");
        if (type.isBlank()) {
            throw new ProtocolException("Missing message type");
        }
        return switch (type) {
            case InboundMessage.AUDIO_CHUNK -> InboundMessage.audio(parseChunk(json));
            case InboundMessage.START_RECORDING -> InboundMessage.startRecording(optText(json, "language"));
            default -> InboundMessage.control(type);
        };
    }

    private AudioChunk parseChunk(JSONObject json) {
        JSONArray data = json.optJSONArray("data");
        if (data == null) {
            throw new ProtocolException("audio_chunk requires a 'data' array of byte values");
        }
        byte[] bytes = new byte[data.length()];
        for (int i = 0; i < bytes.length; i++) {
            int value = data.optInt(i, -1);
            if (value < 0 || value > 255 || !(data.opt(i) instanceof Number)) {
                throw new ProtocolException("audio_chunk data[" + i + "] is not a byte value (0-255)");
            }
            bytes[i] = (byte) value;
        }
        Object seq = json.opt("sequenceNumber");
        Integer sequenceNumber = seq instanceof Number n ? n.intValue() : null;
        return new AudioChunk(bytes, optText(json, "mimeType"), optText(json, "timestamp"), sequenceNumber);
    }

    private static String optText(JSONObject json, String key) {
        Object v = json.opt(key);
        return v == null || v == JSONObject.NULL ? null : String.valueOf(v);
    }
}
