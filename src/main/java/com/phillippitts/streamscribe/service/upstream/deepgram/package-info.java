/**
 * Deepgram live-transcription adapter: socket handling, query parameters and message parsing.
 */
package com.phillippitts.streamscribe.service.upstream.deepgram;
