package com.phillippitts.streamscribe.service.transcript;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Character-bigram Dice coefficient used for near-duplicate detection.
 *
 * <p>{@code dice(a, b) = 2·|bigrams(a) ∩ bigrams(b)| / (|bigrams(a)| + |bigrams(b)|)} over the
 * normalized (trimmed, lower-cased) strings. A single-character string is its own one-element
 * bigram set. Identical normalized strings score 1.0; an empty string scores 0.0 against
 * anything else.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
public final class TextSimilarity {

    private TextSimilarity() {
        // Utility class - prevent instantiation
    }

    /**
     * @return similarity in [0, 1]
     */
    public static double dice(String a, String b) {
        String na = normalize(a);
        String nb = normalize(b);
        if (na.isEmpty() || nb.isEmpty()) {
            return 0.0;
        }
        if (na.equals(nb)) {
            return 1.0;
        }
        Set<String> ba = bigrams(na);
        Set<String> bb = bigrams(nb);
        int intersection = 0;
        for (String g : ba) {
            if (bb.contains(g)) {
                intersection++;
            }
        }
        return (2.0 * intersection) / (ba.size() + bb.size());
    }

    static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    static Set<String> bigrams(String s) {
        Set<String> grams = new HashSet<>();
        if (s.length() == 1) {
            grams.add(s);
            return grams;
        }
        for (int i = 0; i < s.length() - 1; i++) {
            grams.add(s.substring(i, i + 2));
        }
        return grams;
    }
}
