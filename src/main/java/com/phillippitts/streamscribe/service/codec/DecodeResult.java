package com.phillippitts.streamscribe.service.codec;

import com.phillippitts.streamscribe.exception.DecodeException;

import java.util.Objects;

/**
 * Outcome of a decode attempt: either canonical PCM or the {@link DecodeException} describing
 * why decoding failed. Exactly one of the two is non-null.
 */
public final class DecodeResult {

    private final byte[] pcm;
    private final DecodeException error;

    private DecodeResult(byte[] pcm, DecodeException error) {
        this.pcm = pcm;
        this.error = error;
    }

    public static DecodeResult success(byte[] pcm) {
        return new DecodeResult(Objects.requireNonNull(pcm, "pcm"), null);
    }

    public static DecodeResult failure(DecodeException error) {
        return new DecodeResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public byte[] pcm() {
        if (pcm == null) {
            throw new IllegalStateException("No PCM in a failed decode result", error);
        }
        return pcm;
    }

    /**
     * @throws IllegalStateException if this is a success
     */
    public DecodeException error() {
        if (error == null) {
            throw new IllegalStateException("Successful decode result has no error");
        }
        return error;
    }

    /**
     * Returns the PCM or throws the captured {@link DecodeException}.
     */
    public byte[] orElseThrow() {
        if (error != null) {
            throw error;
        }
        return pcm;
    }
}
