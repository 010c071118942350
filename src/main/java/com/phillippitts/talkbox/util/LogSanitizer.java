package com.phillippitts.talkbox.util;

/** Utility for privacy-safe logging of user text. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

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
     * Single-line preview for log messages: line breaks become spaces and text longer than
     * {@code max} is cut and marked with an ellipsis.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ').strip();
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, max) + ELLIPSIS;
    }
}
