package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.service.session.event.SessionEndedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing warnings for abnormal session endings. Throttled per reason to avoid log
 * spam when the provider is down for every session at once.
 */
@Component
class SessionEventsListener {
    private static final Logger LOG = LogManager.getLogger(SessionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSessionEnded(SessionEndedEvent e) {
        switch (e.reason()) {
            case RECONNECT_BUDGET_EXHAUSTED -> {
                if (shouldLog("budget")) {
                    LOG.warn("Session {} gave up reconnecting to the STT provider. "
                            + "Check stream.provider.url / api-key and provider status.", e.sessionId());
                }
            }
            case STALE -> {
                if (shouldLog("stale")) {
                    LOG.warn("Session {} was evicted as stale; its close event was probably lost.", e.sessionId());
                }
            }
            default -> LOG.debug("Session {} ended ({})", e.sessionId(), e.reason().tag());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
