package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.config.properties.HealthSweepProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fleet-wide periodic sweep that tears down sessions with no activity past the staleness
 * threshold, whatever their connection state. Guards against sessions whose close events
 * were lost.
 *
 * <p>Reads each session's last-activity timestamp without taking any session lock.
 */
public class SessionHealthSweeper {

    private static final Logger LOG = LogManager.getLogger(SessionHealthSweeper.class);

    private final SessionRegistry registry;
    private final Duration staleAfter;
    private final Clock clock;

    public SessionHealthSweeper(SessionRegistry registry, HealthSweepProperties props, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.staleAfter = Duration.ofMillis(props.getStaleAfterMs());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Scheduled(fixedDelayString = "${stream.health.sweep-interval-ms:60000}",
            initialDelayString = "${stream.health.sweep-interval-ms:60000}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * @return number of sessions evicted
     */
    public int sweep() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Session session : registry.sessions()) {
            Duration idle = Duration.between(session.lastActivity(), now);
            if (idle.compareTo(staleAfter) > 0) {
                LOG.warn("Evicting stale session {} (idle {} s, state {})",
                        session.id(), idle.toSeconds(), session.state());
                registry.sessionEnded(session, CloseReason.STALE);
                evicted++;
            }
        }
        if (evicted > 0) {
            LOG.info("Health sweep evicted {} sessions ({} remain)", evicted, registry.size());
        }
        return evicted;
    }
}
