package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Destination for flushed transcript blocks. A blank URL selects the logging sink.
 */
@ConfigurationProperties(prefix = "stream.downstream")
@Validated
public class DownstreamProperties {

    private String url = "";

    @Positive
    private int timeoutMs = 5_000;

    public boolean isHttpEnabled() {
        return url != null && !url.isBlank();
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }
}
