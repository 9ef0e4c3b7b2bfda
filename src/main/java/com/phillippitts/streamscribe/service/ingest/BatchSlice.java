package com.phillippitts.streamscribe.service.ingest;

/**
 * PCM selected for one batch.
 *
 * @param pcm canonical PCM bytes of the batch
 * @param end offset the buffer advances to once the batch succeeds
 */
public record BatchSlice(byte[] pcm, int end) {

    public int length() {
        return pcm.length;
    }
}
