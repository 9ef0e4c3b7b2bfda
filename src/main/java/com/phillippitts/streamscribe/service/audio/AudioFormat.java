package com.phillippitts.streamscribe.service.audio;

/**
 * Single source of truth for the canonical audio format.
 * Every batch handed to transcription and every archived recording uses it:
 * 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Canonical sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Canonical bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Canonical number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second at the canonical format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    /** ffmpeg raw output format name matching the canonical sample layout. */
    public static final String FFMPEG_PCM_FORMAT = "s16le";
    /** ffmpeg codec name matching the canonical sample layout. */
    public static final String FFMPEG_PCM_CODEC = "pcm_s16le";

    /** Size of the canonical 44-byte RIFF/WAVE header. */
    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /**
     * Duration in seconds of canonical PCM of the given length, rounded to two decimals.
     */
    public static double durationSeconds(int pcmBytes) {
        double seconds = (double) pcmBytes / REQUIRED_BYTE_RATE;
        return Math.round(seconds * 100.0) / 100.0;
    }
}
