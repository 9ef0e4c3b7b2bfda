package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the WebSocket ingestion endpoint.
 *
 * <p>Properties:
 * <ul>
 *   <li>ingest.default-language - language used until a client sends {@code start_recording} (default: en)</li>
 *   <li>ingest.websocket-path - endpoint path (default: /ws/audio)</li>
 *   <li>ingest.allowed-origins - CORS origins accepted on the handshake (default: *)</li>
 *   <li>ingest.max-text-message-bytes - largest inbound text frame accepted (default: 2 MiB)</li>
 *   <li>ingest.send-time-limit-ms - how long one outbound send may block (default: 10000)</li>
 *   <li>ingest.send-buffer-size-limit - bytes buffered per connection while a send is blocked (default: 512 KiB)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "ingest")
@Validated
public class IngestProperties {

    @NotBlank(message = "Default language must not be blank")
    private String defaultLanguage = "en";

    @NotBlank(message = "WebSocket path must not be blank")
    private String websocketPath = "/ws/audio";

    @NotEmpty(message = "At least one allowed origin is required")
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /**
     * Audio arrives as a JSON array of byte values, so a frame is roughly four times the size
     * of the audio it carries.
     */
    @Positive(message = "Max text message size must be positive")
    private int maxTextMessageBytes = 2 * 1024 * 1024;

    @Positive(message = "Send time limit must be positive")
    private int sendTimeLimitMs = 10_000;

    @Positive(message = "Send buffer size limit must be positive")
    private int sendBufferSizeLimit = 512 * 1024;

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public String getWebsocketPath() {
        return websocketPath;
    }

    public void setWebsocketPath(String websocketPath) {
        this.websocketPath = websocketPath;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public int getMaxTextMessageBytes() {
        return maxTextMessageBytes;
    }

    public void setMaxTextMessageBytes(int maxTextMessageBytes) {
        this.maxTextMessageBytes = maxTextMessageBytes;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
        this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }
}
