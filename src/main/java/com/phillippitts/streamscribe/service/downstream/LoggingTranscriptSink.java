package com.phillippitts.streamscribe.service.downstream;

import com.phillippitts.streamscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sink used when no downstream URL is configured. Logs a preview of each block.
 */
public class LoggingTranscriptSink implements TranscriptSink {

    private static final Logger LOG = LogManager.getLogger(LoggingTranscriptSink.class);

    private static final int PREVIEW_CHARS = 120;

    @Override
    public void deliver(String sessionId, String text) {
        LOG.info("Transcript block for session {} ({} chars): {}",
                sessionId, text.length(), LogSanitizer.truncate(text, PREVIEW_CHARS));
    }

    @Override
    public String name() {
        return "log";
    }
}
