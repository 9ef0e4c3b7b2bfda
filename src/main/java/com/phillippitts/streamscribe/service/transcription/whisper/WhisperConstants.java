package com.phillippitts.streamscribe.service.transcription.whisper;

/**
 * Constants for the whisper.cpp command line and its diagnostics.
 *
 * @see WhisperProcessManager
 */
final class WhisperConstants {

    static final String ENGINE = "whisper";

    /**
     * Maximum characters of stderr included in an error message. Roughly the first 30 lines
     * of whisper.cpp output, which is where model-loading failures are reported.
     */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    /** whisper.cpp appends this to the {@code -of} base name in JSON mode. */
    static final String JSON_SUFFIX = ".json";

    private WhisperConstants() {
        // Utility class - prevent instantiation
    }
}
