package com.phillippitts.streamscribe.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable result of transcribing one batch container.
 *
 * @param text             transcribed text (must not be null; may be empty for silence)
 * @param confidence       confidence score between 0.0 and 1.0
 * @param detectedLanguage language reported by the engine, or {@code null} if it reports none
 * @param timestamp        when the transcription completed
 * @param engineName       engine that produced this result (e.g., "whisper", "openai")
 */
public record TranscriptionResult(
        String text,
        double confidence,
        String detectedLanguage,
        Instant timestamp,
        String engineName
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if confidence is out of range
     * @throws NullPointerException if text, timestamp, or engineName is null
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
    }

    /**
     * Creates a TranscriptionResult stamped with the current time.
     */
    public static TranscriptionResult of(String text, double confidence, String detectedLanguage, String engineName) {
        return new TranscriptionResult(text, confidence, detectedLanguage, Instant.now(), engineName);
    }
}
