package com.phillippitts.streamscribe.service.upstream.deepgram;

import com.phillippitts.streamscribe.config.properties.ProviderProperties;
import com.phillippitts.streamscribe.exception.UpstreamConnectionException;
import com.phillippitts.streamscribe.exception.UpstreamConnectionExceptionBuilder;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.upstream.UpstreamConnection;
import com.phillippitts.streamscribe.service.upstream.UpstreamConnector;
import com.phillippitts.streamscribe.service.upstream.UpstreamListener;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Opens Deepgram live-transcription sockets.
 *
 * <p>The query string announces the PCM format the session forwards (linear16 at the
 * configured rate and channel count) along with model, language, diarization and
 * endpointing options. Authentication uses the {@code Authorization: Token <key>} header.
 */
public class DeepgramConnector implements UpstreamConnector {

    private static final Logger LOG = LogManager.getLogger(DeepgramConnector.class);

    static final String PROVIDER = "deepgram";

    private final WebSocketClient client;
    private final ProviderProperties props;
    private final AudioFormat format;
    private final Clock clock;

    public DeepgramConnector(WebSocketClient client, ProviderProperties props, AudioFormat format, Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.props = Objects.requireNonNull(props, "props");
        this.format = Objects.requireNonNull(format, "format");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<UpstreamConnection> connect(String sessionId, UpstreamListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (!props.hasApiKey()) {
            return CompletableFuture.failedFuture(UpstreamConnectionExceptionBuilder
                    .create("Provider API key is not configured")
                    .session(sessionId)
                    .metadata("provider", PROVIDER)
                    .build());
        }

        DeepgramUpstreamConnection connection = new DeepgramUpstreamConnection(sessionId, format, listener, clock);
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add(HttpHeaders.AUTHORIZATION, "Token " + props.getApiKey());
        URI uri = buildUri();

        long startNanos = System.nanoTime();
        LOG.debug("Connecting session {} to {}", sessionId, uri);
        CompletableFuture<UpstreamConnection> result;
        try {
            result = client.execute(connection.handler(), headers, uri)
                    .thenApply(socket -> (UpstreamConnection) connection);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(handshakeFailure(sessionId, e, startNanos));
        }
        return result.exceptionally(e -> {
            throw handshakeFailure(sessionId, unwrap(e), startNanos);
        });
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    /** Visible for tests */
    URI buildUri() {
        return UriComponentsBuilder.fromUriString(props.getUrl())
                .queryParam("encoding", "linear16")
                .queryParam("sample_rate", format.sampleRate())
                .queryParam("channels", format.channels())
                .queryParam("model", props.getModel())
                .queryParam("language", props.getLanguage())
                .queryParam("smart_format", props.isSmartFormat())
                .queryParam("punctuate", props.isPunctuate())
                .queryParam("diarize", props.isDiarize())
                .queryParam("interim_results", props.isInterimResults())
                .queryParam("utterance_end_ms", props.getUtteranceEndMs())
                .queryParam("endpointing", props.getEndpointingMs())
                .build()
                .toUri();
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private UpstreamConnectionException handshakeFailure(String sessionId, Throwable cause, long startNanos) {
        if (cause instanceof UpstreamConnectionException uce) {
            return uce;
        }
        return UpstreamConnectionExceptionBuilder.create("Provider handshake failed")
                .session(sessionId)
                .cause(cause)
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("provider", PROVIDER)
                .metadata("reason", cause.getMessage())
                .build();
    }
}
