package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Streaming STT provider (Deepgram live API) connection parameters.
 *
 * <p>The API key is normally supplied through the {@code DEEPGRAM_API_KEY} environment
 * variable. A blank key is accepted at startup so the service can boot for local testing;
 * connect attempts then fail and are surfaced through the reconnect path.
 */
@ConfigurationProperties(prefix = "stream.provider")
@Validated
public class ProviderProperties {

    @NotBlank
    private String url = "wss://api.deepgram.com/v1/listen";

    private String apiKey = "";

    @NotBlank
    private String model = "nova-3";

    /** Language hint; {@code multi} enables code-switching. */
    @NotBlank
    private String language = "multi";

    private boolean smartFormat = true;
    private boolean punctuate = true;
    private boolean diarize = true;
    private boolean interimResults = true;

    @Positive
    private int utteranceEndMs = 1000;

    @Positive
    private int endpointingMs = 500;

    @Positive
    private int connectTimeoutMs = 10_000;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public boolean isSmartFormat() {
        return smartFormat;
    }

    public void setSmartFormat(boolean smartFormat) {
        this.smartFormat = smartFormat;
    }

    public boolean isPunctuate() {
        return punctuate;
    }

    public void setPunctuate(boolean punctuate) {
        this.punctuate = punctuate;
    }

    public boolean isDiarize() {
        return diarize;
    }

    public void setDiarize(boolean diarize) {
        this.diarize = diarize;
    }

    public boolean isInterimResults() {
        return interimResults;
    }

    public void setInterimResults(boolean interimResults) {
        this.interimResults = interimResults;
    }

    public int getUtteranceEndMs() {
        return utteranceEndMs;
    }

    public void setUtteranceEndMs(int utteranceEndMs) {
        this.utteranceEndMs = utteranceEndMs;
    }

    public int getEndpointingMs() {
        return endpointingMs;
    }

    public void setEndpointingMs(int endpointingMs) {
        this.endpointingMs = endpointingMs;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }
}
