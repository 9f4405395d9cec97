package com.phillippitts.answercoach.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Entry of a session's append-only transcript log.
 *
 * <p>Speaker speech and injected follow-up questions share one log so coverage evaluation sees
 * follow-ups as context, while the {@link Kind} tag keeps system text out of confidence
 * classification and scoring.
 *
 * @param kind          who produced the text
 * @param text          entry text
 * @param sequenceIndex source sequence index for speaker entries, -1 for follow-ups
 * @param at            when the entry was appended
 */
public record TranscriptEntry(Kind kind, String text, long sequenceIndex, Instant at) {

    public static final String FOLLOWUP_MARKER = "[FOLLOW-UP]";

    private static final Pattern LINE_BREAKS = Pattern.compile("\\R+");

    public enum Kind { SPEAKER, FOLLOWUP }

    public TranscriptEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(at, "at");
    }

    public static TranscriptEntry speaker(TranscriptFragment fragment) {
        return new TranscriptEntry(Kind.SPEAKER, fragment.text(), fragment.sequenceIndex(), fragment.receivedAt());
    }

    public static TranscriptEntry followup(String question, Instant at) {
        return new TranscriptEntry(Kind.FOLLOWUP, question, -1, at);
    }

    /**
     * Text as it appears in the reconstructed answer handed to the coverage oracle: one line,
     * follow-ups prefixed with {@link #FOLLOWUP_MARKER}.
     */
    public String render() {
        String line = LINE_BREAKS.matcher(text).replaceAll(" ").strip();
        return kind == Kind.FOLLOWUP ? FOLLOWUP_MARKER + " " + line : line;
    }

    /**
     * Reconstructed answer: one rendered entry per line, blank entries omitted.
     */
    public static String renderAnswer(List<TranscriptEntry> entries) {
        StringJoiner joiner = new StringJoiner("\n");
        for (TranscriptEntry entry : entries) {
            String line = entry.render();
            if (!line.isEmpty()) {
                joiner.add(line);
            }
        }
        return joiner.toString();
    }

    /**
     * Speaker lines of a reconstructed answer, joined by spaces. Follow-up lines are dropped whole,
     * whatever punctuation the question carries.
     */
    public static String speakerText(String renderedAnswer) {
        if (renderedAnswer == null || renderedAnswer.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(" ");
        for (String line : renderedAnswer.split("\n")) {
            if (!line.startsWith(FOLLOWUP_MARKER)) {
                joiner.add(line);
            }
        }
        return joiner.toString();
    }
}
