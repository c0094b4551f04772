package com.phillippitts.streamscribe.config.websocket;

import com.phillippitts.streamscribe.config.properties.AudioStreamProperties;
import com.phillippitts.streamscribe.presentation.websocket.AudioStreamWebSocketHandler;
import com.phillippitts.streamscribe.service.session.TranscriptionSessionService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the binary audio endpoint at {@value #AUDIO_PATH}.
 */
@Configuration
@EnableWebSocket
public class AudioWebSocketConfig implements WebSocketConfigurer {

    public static final String AUDIO_PATH = "/stream/ws";

    private final TranscriptionSessionService sessionService;
    private final AudioStreamProperties audioProperties;

    public AudioWebSocketConfig(TranscriptionSessionService sessionService, AudioStreamProperties audioProperties) {
        this.sessionService = sessionService;
        this.audioProperties = audioProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(audioStreamWebSocketHandler(), AUDIO_PATH)
                .setAllowedOrigins("*");
    }

    @Bean
    public AudioStreamWebSocketHandler audioStreamWebSocketHandler() {
        return new AudioStreamWebSocketHandler(sessionService);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(audioProperties.getMaxPacketBytes());
        container.setMaxTextMessageBufferSize(8192);
        return container;
    }
}
