package com.phillippitts.streamscribe.service.transcript;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded history of recently accepted fragment texts, oldest evicted first.
 * Not thread-safe; guarded by the owning accumulator's lock.
 */
final class RecentFragmentWindow {

    private final int capacity;
    private final Deque<String> texts;

    RecentFragmentWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.texts = new ArrayDeque<>(capacity);
    }

    void add(String text) {
        if (texts.size() == capacity) {
            texts.removeFirst();
        }
        texts.addLast(text);
    }

    /**
     * @return the highest similarity of {@code text} against any fragment in the window
     */
    double maxSimilarity(String text) {
        double best = 0.0;
        for (String seen : texts) {
            best = Math.max(best, TextSimilarity.dice(seen, text));
            if (best >= 1.0) {
                break;
            }
        }
        return best;
    }

    int size() {
        return texts.size();
    }

    List<String> snapshot() {
        return List.copyOf(texts);
    }
}
