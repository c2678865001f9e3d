package com.phillippitts.lineconsensus.util;

/** Utility for privacy-safe logging of transcribed line text and caller-supplied ids. */
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
     * Like {@link #truncate(String, int)} but marks a cut with a trailing ellipsis.
     */
    public static String preview(String s, int max) {
        String cut = truncate(s, max);
        return s != null && cut.length() < s.length() ? cut + ELLIPSIS : cut;
    }
}
