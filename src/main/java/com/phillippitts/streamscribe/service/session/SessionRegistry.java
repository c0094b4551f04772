package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.domain.SessionSnapshot;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import com.phillippitts.streamscribe.service.session.event.SessionEndedEvent;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide map from session id to {@link Session}.
 *
 * <p>{@link #getOrCreate(String)} is the only way to obtain a session; concurrent callers for
 * the same id converge on one instance. Removal detaches the session first and then closes it,
 * so a torn-down session is never handed out again.
 */
public class SessionRegistry implements SessionEndListener {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final SessionFactory factory;
    private final SessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public SessionRegistry(SessionFactory factory,
                           SessionMetrics metrics,
                           ApplicationEventPublisher publisher,
                           Clock clock) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        metrics.bindActiveSessions(sessions::size);
    }

    /**
     * Returns the live session for {@code sessionId}, creating it on first use.
     */
    public Session getOrCreate(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Session existing = sessions.get(sessionId);
        if (existing != null) {
            return existing;
        }
        boolean[] created = new boolean[1];
        Session session = sessions.computeIfAbsent(sessionId, id -> {
            created[0] = true;
            return factory.create(id, this);
        });
        if (created[0]) {
            metrics.sessionCreated();
            LOG.info("Session {} created ({} active)", sessionId, sessions.size());
        }
        return session;
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Detaches and closes the session.
     *
     * @return true if a session was registered under the id
     */
    public boolean remove(String sessionId, CloseReason reason) {
        Session session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        closeAndPublish(session, reason);
        return true;
    }

    /**
     * Detaches this exact instance (if still registered) and closes it. A newer session
     * registered under the same id is left untouched.
     */
    @Override
    public void sessionEnded(Session session, CloseReason reason) {
        sessions.remove(session.id(), session);
        closeAndPublish(session, reason);
    }

    public List<Session> sessions() {
        return new ArrayList<>(sessions.values());
    }

    public List<SessionSnapshot> snapshots() {
        List<SessionSnapshot> result = new ArrayList<>();
        for (Session session : sessions.values()) {
            result.add(session.snapshot());
        }
        result.sort(Comparator.comparing(SessionSnapshot::createdAt));
        return result;
    }

    public int size() {
        return sessions.size();
    }

    /** Closes every session on application shutdown so buffered transcripts are flushed. */
    @PreDestroy
    public void shutdown() {
        if (sessions.isEmpty()) {
            return;
        }
        LOG.info("Closing {} sessions on shutdown", sessions.size());
        for (String id : new ArrayList<>(sessions.keySet())) {
            remove(id, CloseReason.SHUTDOWN);
        }
    }

    private void closeAndPublish(Session session, CloseReason reason) {
        if (session.close(reason)) {
            publisher.publishEvent(new SessionEndedEvent(session.id(), reason, clock.instant()));
        }
    }
}
