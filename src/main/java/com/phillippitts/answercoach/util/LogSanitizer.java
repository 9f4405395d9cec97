package com.phillippitts.answercoach.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW = 60;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of speech for log lines: whitespace collapsed, cut to 60 characters,
     * with the original length appended when text was dropped.
     */
    public static String preview(String s) {
        return preview(s, DEFAULT_PREVIEW);
    }

    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.strip().replaceAll("\\s+", " ");
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, max) + "...(" + flat.length() + " chars)";
    }
}
