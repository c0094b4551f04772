package com.phillippitts.streamscribe.domain;

import java.time.Instant;

/**
 * Point-in-time view of a session for status endpoints and health reporting.
 *
 * @param sessionId          session identifier
 * @param state              current connection state
 * @param reconnectAttempts  consecutive connection failures since the last successful open
 * @param createdAt          when the session was created
 * @param lastActivity       last genuine audio packet or transcript event
 * @param bufferedCharacters characters waiting in the transcript buffer
 * @param bufferedWords      words waiting in the transcript buffer
 * @param flushScheduled     whether an inactivity flush is pending
 * @param remainingDwellMs   milliseconds until the pending flush fires (0 when none)
 * @param segmentsArchived   archival segments emitted so far
 * @param droppedPackets     packets dropped because they failed to decode
 */
public record SessionSnapshot(
        String sessionId,
        ConnectionState state,
        int reconnectAttempts,
        Instant createdAt,
        Instant lastActivity,
        int bufferedCharacters,
        int bufferedWords,
        boolean flushScheduled,
        long remainingDwellMs,
        long segmentsArchived,
        long droppedPackets
) {}
