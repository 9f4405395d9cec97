package com.phillippitts.answercoach.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Utility for tokenizing text into normalized alphanumeric tokens.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on anything that is not a letter or digit</li>
 *   <li>Convert all tokens to lowercase</li>
 *   <li>Filter out blank tokens</li>
 *   <li>Return immutable list</li>
 * </ul>
 *
 * <p>Used by the offline oracles for overlap scoring of bullets, answers and claims.
 */
public final class TokenizerUtil {

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "of", "to", "in", "on",
            "and", "or", "for", "with", "by", "it", "its", "that", "this", "as", "at", "than",
            "then", "so", "if", "can", "do", "does", "has", "have", "into", "from", "their", "they"
    );

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * Tokenizes text into normalized tokens.
     *
     * @param text input text to tokenize (may be null or blank)
     * @return immutable list of lowercase tokens (empty if no valid tokens)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+");
        List<String> tokens = new ArrayList<>();
        for (String part : parts) {
            if (!part.isBlank()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Distinct content tokens: {@link #tokenize(String)} minus common function words.
     * Falls back to all tokens when the text consists only of function words.
     *
     * @param text input text
     * @return ordered set of content tokens
     */
    public static Set<String> contentTokens(String text) {
        List<String> all = tokenize(text);
        Set<String> content = new LinkedHashSet<>();
        for (String token : all) {
            if (!STOPWORDS.contains(token)) {
                content.add(token);
            }
        }
        return content.isEmpty() ? new LinkedHashSet<>(all) : content;
    }
}
