package com.phillippitts.streamscribe.domain;

import java.util.Locale;

/**
 * How a session's incoming audio is structured, fixed from the first chunk's declared mime type.
 *
 * <ul>
 *   <li>{@link #RAW_PCM_CONTAINER} - self-delimited chunks (e.g. one WAV per chunk); each decodes
 *       independently to PCM on arrival.</li>
 *   <li>{@link #STREAMING_CONTAINER} - cumulative streaming container (WebM/Opus from
 *       MediaRecorder); only the full byte history decodes, so bytes are kept raw.</li>
 *   <li>{@link #UNKNOWN} - no chunk received yet.</li>
 * </ul>
 */
public enum SourceFormat {
    RAW_PCM_CONTAINER,
    STREAMING_CONTAINER,
    UNKNOWN;

    /** Substring that marks a declared mime type as a streaming container. */
    static final String STREAMING_INDICATOR = "webm";

    /**
     * Classifies a declared mime type. Anything that is not a streaming container is treated as
     * self-delimited, including a missing mime type.
     */
    public static SourceFormat fromMimeType(String mimeType) {
        if (mimeType != null && mimeType.toLowerCase(Locale.ROOT).contains(STREAMING_INDICATOR)) {
            return STREAMING_CONTAINER;
        }
        return RAW_PCM_CONTAINER;
    }
}
