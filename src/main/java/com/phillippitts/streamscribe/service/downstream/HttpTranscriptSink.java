package com.phillippitts.streamscribe.service.downstream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * POSTs {@code {"text": ..., "sessionId": ...}} to the analysis service.
 */
public class HttpTranscriptSink implements TranscriptSink {

    private static final Logger LOG = LogManager.getLogger(HttpTranscriptSink.class);

    private final RestClient client;
    private final String url;

    /**
     * @param builder pre-configured builder (timeouts, request factory); a test server may be bound to it
     * @param url     absolute endpoint URL
     */
    public HttpTranscriptSink(RestClient.Builder builder, String url) {
        this.url = Objects.requireNonNull(url, "url");
        this.client = builder.build();
    }

    @Override
    public void deliver(String sessionId, String text) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("text", text);
        body.put("sessionId", sessionId);
        client.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .toBodilessEntity();
        LOG.debug("Delivered {} chars for session {} to {}", text.length(), sessionId, url);
    }

    @Override
    public String name() {
        return "http";
    }
}
