package com.phillippitts.streamscribe.service.ingest;

import java.util.Objects;

/**
 * One inbound audio fragment as sent by the client.
 *
 * @param data           encoded audio bytes
 * @param mimeType       declared mime type (never null; defaults to audio/webm upstream)
 * @param timestamp      client timestamp, echoed back verbatim (may be null)
 * @param sequenceNumber client sequence number (may be null)
 */
public record AudioChunk(byte[] data, String mimeType, String timestamp, Integer sequenceNumber) {

    public static final String DEFAULT_MIME_TYPE = "audio/webm";

    public AudioChunk {
        Objects.requireNonNull(data, "data");
        if (mimeType == null || mimeType.isBlank()) {
            mimeType = DEFAULT_MIME_TYPE;
        }
    }

    /** Sequence number for bookkeeping, -1 when the client sent none. */
    public int sequenceOrUnknown() {
        return sequenceNumber == null ? -1 : sequenceNumber;
    }
}
