package com.phillippitts.streamscribe.config.upstream;

import com.phillippitts.streamscribe.config.properties.AudioStreamProperties;
import com.phillippitts.streamscribe.config.properties.ProviderProperties;
import com.phillippitts.streamscribe.service.upstream.UpstreamConnector;
import com.phillippitts.streamscribe.service.upstream.deepgram.DeepgramConnector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;

/**
 * STT provider client wiring.
 */
@Configuration
public class UpstreamConfig {

    private static final Logger LOG = LogManager.getLogger(UpstreamConfig.class);

    @Bean
    public WebSocketClient providerWebSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    public UpstreamConnector upstreamConnector(WebSocketClient providerWebSocketClient,
                                               ProviderProperties providerProperties,
                                               AudioStreamProperties audioProperties,
                                               Clock clock) {
        if (!providerProperties.hasApiKey()) {
            LOG.warn("stream.provider.api-key is not set; sessions will fail to connect until it is configured");
        }
        return new DeepgramConnector(providerWebSocketClient, providerProperties,
                audioProperties.toAudioFormat(), clock);
    }
}
