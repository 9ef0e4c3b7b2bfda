package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.IngestProperties;
import com.phillippitts.streamscribe.presentation.websocket.AudioWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the audio endpoint at {@code ingest.websocket-path}.
 *
 * <p>Audio arrives as JSON arrays of byte values, roughly four characters per byte, so the
 * container's text buffer is raised to {@code ingest.max-text-message-bytes}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AudioWebSocketHandler audioWebSocketHandler;
    private final IngestProperties ingestProperties;

    public WebSocketConfig(AudioWebSocketHandler audioWebSocketHandler, IngestProperties ingestProperties) {
        this.audioWebSocketHandler = audioWebSocketHandler;
        this.ingestProperties = ingestProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(audioWebSocketHandler, ingestProperties.getWebsocketPath())
                .setAllowedOriginPatterns(ingestProperties.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(ingestProperties.getMaxTextMessageBytes());
        container.setAsyncSendTimeout((long) ingestProperties.getSendTimeLimitMs());
        return container;
    }
}
