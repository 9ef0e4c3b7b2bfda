package com.phillippitts.streamscribe.service.codec;

import com.phillippitts.streamscribe.exception.DecodeException;

/**
 * Converts source audio in any supported container into canonical PCM
 * (16 kHz, 16-bit signed little-endian, mono).
 *
 * <p>Implementations must be thread-safe: one instance is shared by every session.
 */
public interface CodecTranscoder {

    /**
     * Decodes {@code source} to canonical PCM.
     *
     * @param source     encoded audio bytes
     * @param formatHint container name to force (e.g. "webm", "ogg"), or {@code null} to let the
     *                   decoder detect the format
     * @return canonical PCM bytes (may be empty when the source holds no complete audio frame)
     * @throws DecodeException if the bytes cannot be decoded
     */
    byte[] decode(byte[] source, String formatHint);
}
