package com.phillippitts.streamscribe.service.transcription;

import com.phillippitts.streamscribe.domain.TranscriptionResult;
import com.phillippitts.streamscribe.exception.TranscriptionException;

/**
 * Turns one canonical WAV container into text.
 *
 * <p>Called synchronously from a session's worker, so a slow call delays only that session.
 * Implementations must be thread-safe because different sessions call concurrently.
 */
public interface TranscriptionOracle {

    /**
     * @param wavContainer canonical WAV container (16 kHz, 16-bit, mono)
     * @param language     language code requested by the session (e.g. "en")
     * @return transcription of the whole container
     * @throws TranscriptionException if the engine fails; the caller keeps the batch for retry
     */
    TranscriptionResult transcribe(byte[] wavContainer, String language);

    /**
     * @return short engine identifier used in logs and metrics
     */
    String getEngineName();
}
