package com.phillippitts.streamscribe;

import com.phillippitts.streamscribe.config.properties.ArchiveProperties;
import com.phillippitts.streamscribe.config.properties.AudioStreamProperties;
import com.phillippitts.streamscribe.config.properties.ConnectionProperties;
import com.phillippitts.streamscribe.config.properties.DownstreamProperties;
import com.phillippitts.streamscribe.config.properties.HealthSweepProperties;
import com.phillippitts.streamscribe.config.properties.ProviderProperties;
import com.phillippitts.streamscribe.config.properties.ThreadPoolProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ProviderProperties.class,
        AudioStreamProperties.class,
        ConnectionProperties.class,
        TranscriptProperties.class,
        HealthSweepProperties.class,
        ArchiveProperties.class,
        DownstreamProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class StreamScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamScribeApplication.class, args);
    }

}
