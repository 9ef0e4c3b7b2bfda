package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.service.audio.AudioFormat;

/**
 * One batch ready for transcription.
 *
 * @param slice      PCM selected from the session buffer, committed after success
 * @param container  canonical WAV container wrapping {@code slice}
 * @param chunkCount pending chunks the batch covers
 */
public record PackagedBatch(BatchSlice slice, byte[] container, int chunkCount) {

    public int pcmBytes() {
        return slice.length();
    }

    public double durationSeconds() {
        return AudioFormat.durationSeconds(slice.length());
    }
}
