package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the local whisper.cpp oracle.
 * Binds to properties prefixed with "transcription.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * transcription.whisper.binary-path=tools/whisper.cpp/main
 * transcription.whisper.model-path=models/ggml-base.bin
 * transcription.whisper.timeout-seconds=30
 * transcription.whisper.threads=4
 * transcription.whisper.max-stdout-bytes=1048576
 * </pre>
 *
 * <p>The language is not configured here: each batch is transcribed in its session's language.
 *
 * @param binaryPath     Path to the whisper.cpp binary executable
 * @param modelPath      Path to the GGML model file (.bin); use a multilingual model when
 *                       sessions may request languages other than English
 * @param timeoutSeconds Maximum time to wait for one batch (in seconds)
 * @param threads        Number of CPU threads to use for transcription
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "transcription.whisper")
@Validated
public record WhisperConfig(
        @DefaultValue("tools/whisper.cpp/main")
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @DefaultValue("models/ggml-base.bin")
        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @DefaultValue("30")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("4")
        @Positive(message = "Thread count must be positive")
        int threads,

        @DefaultValue("1048576")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {}
