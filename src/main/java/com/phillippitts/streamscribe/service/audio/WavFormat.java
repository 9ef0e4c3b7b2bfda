package com.phillippitts.streamscribe.service.audio;

/**
 * Structural constants for the RIFF/WAVE container, used by {@link WavContainer}
 * to locate chunks without magic numbers.
 *
 * <pre>
 * RIFF header (12 bytes)      "RIFF" + size + "WAVE"
 * fmt chunk                   id + size (8 bytes), data (at least 16 bytes)
 * data chunk                  id + size (8 bytes), PCM payload
 * </pre>
 *
 * @see WavContainer
 * @since 1.0
 */
public final class WavFormat {

    /** Size of the RIFF header in bytes. */
    public static final int RIFF_HEADER_SIZE = 12;

    /** Size of a chunk header in bytes (chunk ID + chunk size). */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Minimum size of the fmt chunk data in bytes for PCM. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** Audio format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
