package com.phillippitts.streamscribe.config.downstream;

import com.phillippitts.streamscribe.config.properties.DownstreamProperties;
import com.phillippitts.streamscribe.service.downstream.HttpTranscriptSink;
import com.phillippitts.streamscribe.service.downstream.LoggingTranscriptSink;
import com.phillippitts.streamscribe.service.downstream.TranscriptHandoff;
import com.phillippitts.streamscribe.service.downstream.TranscriptSink;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Downstream analysis hand-off wiring. A blank {@code stream.downstream.url} selects the
 * logging sink.
 */
@Configuration
public class DownstreamConfig {

    private static final Logger LOG = LogManager.getLogger(DownstreamConfig.class);

    @Bean
    public TranscriptSink transcriptSink(DownstreamProperties props, RestClient.Builder restClientBuilder) {
        if (!props.isHttpEnabled()) {
            LOG.info("stream.downstream.url not set; transcript blocks will be logged only");
            return new LoggingTranscriptSink();
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getTimeoutMs());
        requestFactory.setReadTimeout(props.getTimeoutMs());
        LOG.info("Delivering transcript blocks to {}", props.getUrl());
        return new HttpTranscriptSink(restClientBuilder.requestFactory(requestFactory), props.getUrl());
    }

    @Bean
    public TranscriptHandoff transcriptHandoff(TranscriptSink transcriptSink,
                                               @Qualifier("handoffExecutor") Executor handoffExecutor,
                                               ApplicationEventPublisher publisher,
                                               SessionMetrics metrics,
                                               Clock clock) {
        return new TranscriptHandoff(transcriptSink, handoffExecutor, publisher, metrics, clock);
    }
}
