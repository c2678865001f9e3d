package com.phillippitts.lineconsensus.service.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Utility for splitting transcriptions into whitespace-separated words.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on runs of Unicode whitespace and of the information separators U+001C to U+001F</li>
 *   <li>Keep case, punctuation and markup untouched</li>
 *   <li>Drop empty tokens produced by leading or trailing whitespace</li>
 *   <li>Return immutable list</li>
 * </ul>
 */
public final class WordTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("(?U)[\\s\\x1C-\\x1F]+");

    private WordTokenizer() {
        // Prevent instantiation
    }

    /**
     * Splits text into words in left-to-right order.
     *
     * @param text input text (may be null or blank)
     * @return immutable list of words (empty if the text holds no words)
     */
    public static List<String> words(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> words = new ArrayList<>();
        for (String part : WHITESPACE.split(text)) {
            if (!part.isEmpty()) {
                words.add(part);
            }
        }
        return List.copyOf(words);
    }
}
