/**
 * Session aggregate, connection supervision and the process-wide session registry.
 *
 * <p>A {@link com.phillippitts.streamscribe.service.session.Session} owns everything for one
 * audio source; the {@link com.phillippitts.streamscribe.service.session.SessionRegistry}
 * owns the sessions. Timers run on the shared session scheduler; no session ever blocks
 * another.
 */
package com.phillippitts.streamscribe.service.session;
