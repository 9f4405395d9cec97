package com.phillippitts.answercoach.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A follow-up question that was generated and shown to the speaker. Never mutated once logged.
 *
 * @param bulletId  bullet the question targets
 * @param question  question text
 * @param emittedAt emission time, also the bullet's new cooldown anchor
 */
public record FollowupRecord(String bulletId, String question, Instant emittedAt) {

    public FollowupRecord {
        Objects.requireNonNull(bulletId, "bulletId");
        Objects.requireNonNull(question, "question");
        Objects.requireNonNull(emittedAt, "emittedAt");
    }
}
