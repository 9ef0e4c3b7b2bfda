package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Selects the transcription oracle and holds settings shared by all of them.
 *
 * <p>Engine-specific settings live under {@code transcription.whisper.*} and
 * {@code transcription.openai.*}.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public class TranscriptionProperties {

    public enum Provider { WHISPER, OPENAI }

    @NotNull
    private Provider provider = Provider.WHISPER;

    /**
     * Confidence reported for engines that return none. Neither whisper.cpp JSON output nor the
     * OpenAI transcription endpoint carries a usable overall score.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultConfidence = 0.95;

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public void setDefaultConfidence(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }
}
