package com.phillippitts.answercoach.service.coverage;

import java.util.ArrayList;
import java.util.List;

/**
 * Naive claim substitute: one claim per sentence-like segment.
 * Used when the claim extractor is unavailable.
 */
public final class SentenceSplitter {

    private SentenceSplitter() {
    }

    /**
     * Splits on sentence punctuation and line breaks, dropping blank segments.
     *
     * @param text speech text (may be null)
     * @return trimmed segments in order
     */
    public static List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : text.split("[.!?;]+|\\R")) {
            String s = part.strip();
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return List.copyOf(out);
    }
}
