package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Optional archival of decoded audio as fixed-length WAV segments.
 */
@ConfigurationProperties(prefix = "stream.archive")
@Validated
public class ArchiveProperties {

    private boolean enabled = false;

    @NotBlank
    private String directory = "audio-archive";

    @Positive
    private int segmentSeconds = 5;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public int getSegmentSeconds() {
        return segmentSeconds;
    }

    public void setSegmentSeconds(int segmentSeconds) {
        this.segmentSeconds = segmentSeconds;
    }
}
