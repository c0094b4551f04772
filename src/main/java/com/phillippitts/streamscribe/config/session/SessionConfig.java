package com.phillippitts.streamscribe.config.session;

import com.phillippitts.streamscribe.config.properties.ArchiveProperties;
import com.phillippitts.streamscribe.config.properties.AudioStreamProperties;
import com.phillippitts.streamscribe.config.properties.ConnectionProperties;
import com.phillippitts.streamscribe.config.properties.HealthSweepProperties;
import com.phillippitts.streamscribe.config.properties.ProviderProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptProperties;
import com.phillippitts.streamscribe.service.audio.decode.AudioFrameDecoderFactory;
import com.phillippitts.streamscribe.service.audio.segment.SegmentArchive;
import com.phillippitts.streamscribe.service.downstream.TranscriptHandoff;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import com.phillippitts.streamscribe.service.session.SessionFactory;
import com.phillippitts.streamscribe.service.session.SessionHealthSweeper;
import com.phillippitts.streamscribe.service.session.SessionRegistry;
import com.phillippitts.streamscribe.service.session.TranscriptionSessionService;
import com.phillippitts.streamscribe.service.upstream.UpstreamConnector;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the session registry and its collaborators explicitly.
 * Uses constructor injection to manage common dependencies across bean methods.
 */
@Configuration
public class SessionConfig {

    private final SessionMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public SessionConfig(SessionMetrics metrics, ApplicationEventPublisher publisher) {
        this.metrics = metrics;
        this.publisher = publisher;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionFactory sessionFactory(AudioFrameDecoderFactory decoders,
                                         SegmentArchive archive,
                                         UpstreamConnector connector,
                                         TranscriptHandoff handoff,
                                         @Qualifier("sessionScheduler") TaskScheduler scheduler,
                                         @Qualifier("upstreamExecutor") Executor upstreamExecutor,
                                         Clock clock,
                                         ProviderProperties providerProperties,
                                         ConnectionProperties connectionProperties,
                                         TranscriptProperties transcriptProperties,
                                         ArchiveProperties archiveProperties) {
        return new SessionFactory(decoders, archive, connector, handoff, scheduler, upstreamExecutor, clock,
                metrics, providerProperties, connectionProperties, transcriptProperties, archiveProperties);
    }

    @Bean
    public SessionRegistry sessionRegistry(SessionFactory sessionFactory, Clock clock) {
        return new SessionRegistry(sessionFactory, metrics, publisher, clock);
    }

    @Bean
    public SessionHealthSweeper sessionHealthSweeper(SessionRegistry sessionRegistry,
                                                     HealthSweepProperties props,
                                                     Clock clock) {
        return new SessionHealthSweeper(sessionRegistry, props, clock);
    }

    @Bean
    public TranscriptionSessionService transcriptionSessionService(SessionRegistry sessionRegistry,
                                                                   AudioStreamProperties audioProperties) {
        return new TranscriptionSessionService(sessionRegistry, audioProperties);
    }
}
