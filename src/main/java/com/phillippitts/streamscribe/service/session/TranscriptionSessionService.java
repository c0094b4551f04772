package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.config.properties.AudioStreamProperties;
import com.phillippitts.streamscribe.domain.SessionSnapshot;
import com.phillippitts.streamscribe.exception.InvalidAudioException;
import com.phillippitts.streamscribe.exception.SessionNotFoundException;
import com.phillippitts.streamscribe.exception.SessionTerminatedException;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for the inbound audio boundary (HTTP and WebSocket).
 *
 * <p>Validates requests, resolves sessions through the {@link SessionRegistry} and tags every
 * log line with the session id.
 */
public class TranscriptionSessionService {

    private static final Logger LOG = LogManager.getLogger(TranscriptionSessionService.class);

    private static final int MAX_SESSION_ID_LENGTH = 128;

    private final SessionRegistry registry;
    private final int maxPacketBytes;

    public TranscriptionSessionService(SessionRegistry registry, AudioStreamProperties audioProps) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.maxPacketBytes = audioProps.getMaxPacketBytes();
    }

    /**
     * Routes one compressed packet to its session, creating the session on first use.
     *
     * <p>If the registered session ended between lookup and delivery (reconnect budget exhausted,
     * auto-close), it is discarded and the packet starts a fresh session once.
     *
     * @throws InvalidAudioException if the id or packet is invalid
     */
    public void processAudio(String sessionId, byte[] packet) {
        validateSessionId(sessionId);
        if (packet == null || packet.length == 0) {
            throw new InvalidAudioException(0, "audio packet is empty");
        }
        if (packet.length > maxPacketBytes) {
            throw new InvalidAudioException(packet.length, "packet exceeds " + maxPacketBytes + " bytes");
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            Session session = registry.getOrCreate(sessionId);
            try {
                session.acceptAudio(packet);
            } catch (SessionTerminatedException e) {
                LOG.info("Session {} had ended ({}); starting a new one", sessionId, e.getState());
                registry.sessionEnded(session, reasonOf(session));
                registry.getOrCreate(sessionId).acceptAudio(packet);
            }
        }
    }

    /**
     * Same as {@link #processAudio(String, byte[])} for base64-encoded payloads.
     */
    public void processBase64(String sessionId, String audioData) {
        if (audioData == null || audioData.isBlank()) {
            throw new InvalidAudioException("audioData is required");
        }
        byte[] packet;
        try {
            packet = Base64.getDecoder().decode(audioData.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidAudioException("audioData is not valid base64");
        }
        processAudio(sessionId, packet);
    }

    /**
     * Creates the session if needed and opens the provider connection.
     */
    public SessionSnapshot connect(String sessionId) {
        validateSessionId(sessionId);
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            Session session = registry.getOrCreate(sessionId);
            try {
                session.start();
            } catch (SessionTerminatedException e) {
                registry.sessionEnded(session, reasonOf(session));
                session = registry.getOrCreate(sessionId);
                session.start();
            }
            return session.snapshot();
        }
    }

    /**
     * Final flush and close.
     *
     * @throws SessionNotFoundException if no session is registered under the id
     */
    public void disconnect(String sessionId) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", String.valueOf(sessionId))) {
            if (!registry.remove(sessionId, CloseReason.CLIENT_DISCONNECT)) {
                throw new SessionNotFoundException(sessionId);
            }
        }
    }

    /**
     * Caller-forced flush.
     *
     * @return flushed text, empty when nothing was buffered
     * @throws SessionNotFoundException if no session is registered under the id
     */
    public Optional<String> flushNow(String sessionId) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", String.valueOf(sessionId))) {
            return require(sessionId).flushNow();
        }
    }

    public SessionSnapshot status(String sessionId) {
        return require(sessionId).snapshot();
    }

    public List<SessionSnapshot> listSessions() {
        return registry.snapshots();
    }

    private Session require(String sessionId) {
        if (sessionId == null) {
            throw new SessionNotFoundException("null");
        }
        return registry.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private static CloseReason reasonOf(Session session) {
        CloseReason reason = session.closeReason();
        return reason != null ? reason : CloseReason.RECONNECT_BUDGET_EXHAUSTED;
    }

    private static void validateSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidAudioException("sessionId is required");
        }
        if (sessionId.length() > MAX_SESSION_ID_LENGTH) {
            throw new InvalidAudioException("sessionId exceeds " + MAX_SESSION_ID_LENGTH + " characters");
        }
    }
}
