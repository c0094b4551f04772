package com.phillippitts.streamscribe.service.transcript;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered speaker turns accepted for one session.
 *
 * <p>A fragment with the same speaker as the current turn, or with no speaker label, is
 * appended to the current turn with a single space. A different speaker label starts a new
 * turn. Rendering depends on how many distinct speakers the block contains: with fewer than
 * two, the text is rendered plain; otherwise every labeled turn is prefixed
 * {@code "Speaker N: "} and turns are separated by a blank line.
 *
 * <p>Labels therefore appear only once a second speaker joins the block: a block spoken by
 * one speaker carries no {@code "Speaker N: "} prefix, even on its first turn.
 *
 * <p>The last-known speaker survives {@link #drain()}, so a block that starts after a flush
 * continues the previous speaker's turn rather than forcing a new one.
 *
 * <p>Not thread-safe; guarded by the owning accumulator's lock.
 */
final class TranscriptBuffer {

    static final String TURN_SEPARATOR = "\n\n";

    private final List<Turn> turns = new ArrayList<>();
    private Integer lastSpeaker;
    private int characters;
    private int words;

    void append(String text, Integer speaker) {
        Objects.requireNonNull(text, "text");
        Turn current = turns.isEmpty() ? null : turns.get(turns.size() - 1);
        Integer effective = speaker != null ? speaker : lastSpeaker;
        if (current == null || !Objects.equals(current.speaker, effective)) {
            turns.add(new Turn(effective, text));
        } else {
            current.text.append(' ').append(text);
        }
        if (speaker != null) {
            lastSpeaker = speaker;
        }
        characters += text.length();
        words += countWords(text);
    }

    String render() {
        if (turns.isEmpty()) {
            return "";
        }
        if (distinctSpeakers() < 2) {
            StringBuilder sb = new StringBuilder();
            for (Turn t : turns) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(t.text);
            }
            return sb.toString();
        }
        StringBuilder sb = new StringBuilder();
        for (Turn t : turns) {
            if (sb.length() > 0) {
                sb.append(TURN_SEPARATOR);
            }
            if (t.speaker != null) {
                sb.append("Speaker ").append(t.speaker).append(": ");
            }
            sb.append(t.text);
        }
        return sb.toString();
    }

    /**
     * Renders and clears the buffer. The last-known speaker is kept.
     *
     * @return rendered text, empty when nothing was buffered
     */
    String drain() {
        String text = render();
        turns.clear();
        characters = 0;
        words = 0;
        return text;
    }

    boolean isEmpty() {
        return turns.isEmpty();
    }

    Integer lastSpeaker() {
        return lastSpeaker;
    }

    int turnCount() {
        return turns.size();
    }

    int characters() {
        return characters;
    }

    int words() {
        return words;
    }

    private int distinctSpeakers() {
        Set<Integer> speakers = new HashSet<>();
        for (Turn t : turns) {
            if (t.speaker != null) {
                speakers.add(t.speaker);
            }
        }
        return speakers.size();
    }

    private static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static final class Turn {
        private final Integer speaker;
        private final StringBuilder text;

        private Turn(Integer speaker, String text) {
            this.speaker = speaker;
            this.text = new StringBuilder(text);
        }
    }
}
