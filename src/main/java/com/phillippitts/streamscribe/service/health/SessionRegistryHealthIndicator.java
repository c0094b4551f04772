package com.phillippitts.streamscribe.service.health;

import com.phillippitts.streamscribe.domain.ConnectionState;
import com.phillippitts.streamscribe.service.session.Session;
import com.phillippitts.streamscribe.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for live transcription sessions.
 *
 * <p>Reports session counts by connection state:
 * <ul>
 *   <li>UP: no session is recovering from a lost provider connection</li>
 *   <li>DEGRADED: at least one session is failing or backing off</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SessionRegistryHealthIndicator implements HealthIndicator {

    private final SessionRegistry registry;

    public SessionRegistryHealthIndicator(SessionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Map<ConnectionState, Integer> byState = new EnumMap<>(ConnectionState.class);
        int recovering = 0;
        for (Session session : registry.sessions()) {
            ConnectionState state = session.state();
            byState.merge(state, 1, Integer::sum);
            if (state.isRecovering()) {
                recovering++;
            }
        }

        Map<String, Integer> counts = new TreeMap<>();
        byState.forEach((state, count) -> counts.put(state.name(), count));

        Health.Builder builder = new Health.Builder();
        if (recovering == 0) {
            builder.up()
                    .withDetail("status", "All sessions connected or idle");
        } else {
            builder.status("DEGRADED")
                    .withDetail("status", recovering + " session(s) reconnecting to the provider");
        }
        return builder
                .withDetail("activeSessions", registry.size())
                .withDetail("sessionsByState", counts)
                .build();
    }
}
