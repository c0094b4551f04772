package com.phillippitts.streamscribe.util;

/** Utility for privacy-safe logging of transcript previews and client-supplied identifiers. */
public final class LogSanitizer {

    private static final int MAX_FILE_NAME = 128;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Maps a client-supplied identifier to a single safe path component: characters outside
     * {@code [A-Za-z0-9._-]} become {@code _}, leading dots are replaced and the result is
     * capped in length. Returns {@code "_"} for null or empty input.
     */
    public static String toFileName(String s) {
        if (s == null || s.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(Math.min(s.length(), MAX_FILE_NAME));
        for (int i = 0; i < s.length() && sb.length() < MAX_FILE_NAME; i++) {
            char c = s.charAt(i);
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '_' || (c == '.' && sb.length() > 0);
            sb.append(safe ? c : '_');
        }
        return sb.toString();
    }
}
