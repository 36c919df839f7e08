package com.phillippitts.consulttranslator.util;

/** Utility for privacy-safe logging of conversation text. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Single-line preview of at most {@code max} characters of text: whitespace runs collapse to
     * one space and truncated text ends with {@code "..."}. Returns "" for null or max <= 0.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String oneLine = s.strip().replaceAll("\\s+", " ");
        if (oneLine.length() <= max) {
            return oneLine;
        }
        if (max <= ELLIPSIS.length()) {
            return oneLine.substring(0, max);
        }
        return oneLine.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }
}
