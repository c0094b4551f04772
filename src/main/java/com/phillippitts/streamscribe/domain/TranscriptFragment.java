package com.phillippitts.streamscribe.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One transcript event emitted by the STT provider.
 *
 * <p>Interim fragments are transient and superseded by later events; only final fragments
 * are buffered.
 *
 * @param text      transcribed text, trimmed and never empty
 * @param speaker   diarization label, or {@code null} when the provider did not attribute one
 * @param isFinal   provider's finality flag
 * @param arrivedAt when the event was received from the provider
 */
public record TranscriptFragment(
        String text,
        Integer speaker,
        boolean isFinal,
        Instant arrivedAt
) {

    /**
     * @throws NullPointerException if text or arrivedAt is null
     * @throws IllegalArgumentException if text is blank or speaker is negative
     */
    public TranscriptFragment {
        Objects.requireNonNull(text, "Fragment text must not be null");
        text = text.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Fragment text must not be blank");
        }
        if (speaker != null && speaker < 0) {
            throw new IllegalArgumentException("Speaker label must be non-negative, got: " + speaker);
        }
        Objects.requireNonNull(arrivedAt, "Arrival timestamp must not be null");
    }

    public static TranscriptFragment finalFragment(String text, Integer speaker) {
        return new TranscriptFragment(text, speaker, true, Instant.now());
    }

    public static TranscriptFragment interimFragment(String text, Integer speaker) {
        return new TranscriptFragment(text, speaker, false, Instant.now());
    }

    public boolean hasSpeaker() {
        return speaker != null;
    }
}
