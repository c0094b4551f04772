package com.phillippitts.streamscribe.service.session;

/**
 * Notified when a session ends itself (inactivity or exhausted reconnect budget), so the
 * owner can detach and tear it down.
 */
@FunctionalInterface
public interface SessionEndListener {

    void sessionEnded(Session session, CloseReason reason);
}
