package com.phillippitts.answercoach.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One unit of speech-to-text output as delivered by the transcript source.
 *
 * <p>Sequence indexes are advisory: the engine processes fragments in arrival order and only
 * logs gaps or reordering.
 *
 * @param sequenceIndex index assigned by the transcript source
 * @param text          raw transcribed text (may be empty for silence)
 * @param receivedAt    when the engine received the fragment
 */
public record TranscriptFragment(long sequenceIndex, String text, Instant receivedAt) {

    public TranscriptFragment {
        Objects.requireNonNull(text, "Fragment text must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    }

    public static TranscriptFragment of(long sequenceIndex, String text) {
        return new TranscriptFragment(sequenceIndex, text, Instant.now());
    }
}
