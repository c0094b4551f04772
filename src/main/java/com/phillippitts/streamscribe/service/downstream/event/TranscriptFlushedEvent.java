package com.phillippitts.streamscribe.service.downstream.event;

import com.phillippitts.streamscribe.service.transcript.FlushTrigger;

import java.time.Instant;

/**
 * Emitted for every non-empty transcript block released by a session.
 *
 * @param sessionId session the block belongs to
 * @param text      rendered block
 * @param trigger   why the block was released
 * @param timestamp when the block was released
 */
public record TranscriptFlushedEvent(
        String sessionId,
        String text,
        FlushTrigger trigger,
        Instant timestamp
) {}
