package com.phillippitts.streamscribe.service.session.event;

import com.phillippitts.streamscribe.service.session.CloseReason;

import java.time.Instant;

/**
 * Emitted after a session has been detached from the registry and torn down.
 *
 * @param sessionId ended session
 * @param reason    why it ended
 * @param timestamp when it ended
 */
public record SessionEndedEvent(
        String sessionId,
        CloseReason reason,
        Instant timestamp
) {}
