package com.phillippitts.axiom.util;

/** Privacy-safe previews of user text for log lines. */
public final class LogSanitizer {

    public static final int DEFAULT_PREVIEW_CHARS = 40;

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
     * Single-line preview: line breaks and tabs become spaces, long text gets an ellipsis
     * and its total length.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ");
        if (flat.length() <= DEFAULT_PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW_CHARS) + "... (" + s.length() + " chars)";
    }
}
