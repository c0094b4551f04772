package com.phillippitts.streamscribe.config.audio;

import com.phillippitts.streamscribe.config.properties.ArchiveProperties;
import com.phillippitts.streamscribe.config.properties.AudioStreamProperties;
import com.phillippitts.streamscribe.service.audio.decode.AudioFrameDecoderFactory;
import com.phillippitts.streamscribe.service.audio.segment.NoopSegmentArchive;
import com.phillippitts.streamscribe.service.audio.segment.SegmentArchive;
import com.phillippitts.streamscribe.service.audio.segment.WavSegmentArchive;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Decoder and archival wiring.
 */
@Configuration
public class AudioConfig {

    private static final Logger LOG = LogManager.getLogger(AudioConfig.class);

    @Bean
    public AudioFrameDecoderFactory audioFrameDecoderFactory(AudioStreamProperties props) {
        LOG.info("Inbound audio codec: {} -> PCM {}", props.getCodec(), props.toAudioFormat());
        return new AudioFrameDecoderFactory(props);
    }

    /**
     * WAV archive, active when {@code stream.archive.enabled=true}.
     */
    @Bean
    @ConditionalOnProperty(prefix = "stream.archive", name = "enabled", havingValue = "true")
    public SegmentArchive wavSegmentArchive(ArchiveProperties props) {
        Path root = Paths.get(props.getDirectory()).toAbsolutePath();
        LOG.info("Archiving {}-second audio segments under {}", props.getSegmentSeconds(), root);
        return new WavSegmentArchive(root);
    }

    /**
     * Discarding archive. Active when archival is disabled or not configured.
     */
    @Bean
    @ConditionalOnProperty(prefix = "stream.archive", name = "enabled", havingValue = "false", matchIfMissing = true)
    public SegmentArchive noopSegmentArchive() {
        return new NoopSegmentArchive();
    }
}
