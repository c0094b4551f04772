/**
 * Provider-neutral contract for streaming audio to a speech-to-text service.
 *
 * <p>{@link com.phillippitts.streamscribe.service.upstream.UpstreamConnector} opens single-use
 * {@link com.phillippitts.streamscribe.service.upstream.UpstreamConnection}s; reconnect policy
 * lives with the session, not here.
 */
package com.phillippitts.streamscribe.service.upstream;
