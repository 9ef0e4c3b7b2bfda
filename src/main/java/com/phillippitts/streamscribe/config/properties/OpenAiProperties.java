package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for an OpenAI-compatible {@code /audio/transcriptions} endpoint.
 * Binds to properties prefixed with "transcription.openai".
 *
 * @param baseUrl        API root, without the trailing path (e.g. https://api.openai.com/v1)
 * @param apiKey         bearer token; blank is allowed for self-hosted endpoints without auth
 * @param model          model name sent with each request
 * @param timeoutSeconds read timeout for one request
 */
@ConfigurationProperties(prefix = "transcription.openai")
@Validated
public record OpenAiProperties(
        @DefaultValue("https://api.openai.com/v1")
        @NotBlank(message = "OpenAI base URL must not be blank")
        String baseUrl,

        @DefaultValue("")
        String apiKey,

        @DefaultValue("whisper-1")
        @NotBlank(message = "OpenAI model must not be blank")
        String model,

        @DefaultValue("60")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
