package com.phillippitts.lineconsensus.service.text;

import java.util.regex.Pattern;

/**
 * Prepares transcriptions for comparison.
 *
 * <p>Every {@code [...]} tag is removed (non-greedy, leftmost first, all occurrences), then
 * whitespace runs collapse into single spaces and the ends are trimmed:
 * {@code "Hello [sic] world   end"} becomes {@code "Hello world end"}.
 *
 * <p>Only used to compare texts; stored and displayed transcriptions are never normalized.
 */
public final class TextNormalizer {

    private static final Pattern TAG = Pattern.compile("\\[.*?]");

    private TextNormalizer() {
    }

    /**
     * Strips inline tags and collapses whitespace.
     *
     * @param text raw transcription (null is treated as empty)
     * @return normalized text, never null
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String untagged = TAG.matcher(text).replaceAll("");
        return String.join(" ", WordTokenizer.words(untagged));
    }
}
