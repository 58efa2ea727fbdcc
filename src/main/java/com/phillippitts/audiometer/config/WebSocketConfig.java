package com.phillippitts.audiometer.config;

import com.phillippitts.audiometer.config.properties.WebSocketProperties;
import com.phillippitts.audiometer.presentation.websocket.AudioStreamWebSocketHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the audio stream handler at {@code websocket.path}.
 * Message size limits are applied per connection by the handler.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger LOG = LogManager.getLogger(WebSocketConfig.class);

    private final AudioStreamWebSocketHandler handler;
    private final WebSocketProperties properties;

    public WebSocketConfig(AudioStreamWebSocketHandler handler, WebSocketProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getPath())
                .setAllowedOrigins(properties.getAllowedOrigins().toArray(String[]::new));
        LOG.info("Audio WebSocket registered at {} (allowedOrigins={})",
                properties.getPath(), properties.getAllowedOrigins());
    }
}
