package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the ffmpeg-backed codec transcoder.
 * Binds to properties prefixed with "codec.ffmpeg".
 *
 * <p>Example application.properties:
 * <pre>
 * codec.ffmpeg.binary-path=/usr/bin/ffmpeg
 * codec.ffmpeg.timeout-seconds=30
 * codec.ffmpeg.max-output-bytes=67108864
 * </pre>
 *
 * @param binaryPath     ffmpeg executable, resolved through PATH when not absolute
 * @param timeoutSeconds maximum time one decode may take
 * @param maxOutputBytes cap on decoded PCM per call; a full-session re-decode of a long
 *                       streaming session is the largest expected output. Output past the
 *                       cap fails the decode rather than returning a shortened stream
 */
@ConfigurationProperties(prefix = "codec.ffmpeg")
@Validated
public record CodecProperties(
        @DefaultValue("ffmpeg")
        @NotBlank(message = "ffmpeg binary path must not be blank")
        String binaryPath,

        @DefaultValue("30")
        @Positive(message = "Decode timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("268435456")
        @Positive(message = "Max output bytes must be positive")
        int maxOutputBytes
) {}
