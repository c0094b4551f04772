package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.domain.TranscriptFragment;

/**
 * Events a {@link ConnectionSupervisor} raises to its owning session.
 */
interface SupervisorCallbacks {

    /** A provider fragment arrived on the current or a just-replaced connection. */
    void onTranscript(TranscriptFragment fragment);

    /**
     * The supervisor ended the session on its own: auto-close after inactivity, or the
     * reconnect budget ran out. Called without any supervisor lock held.
     */
    void onEnded(CloseReason reason);
}
