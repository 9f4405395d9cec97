package com.phillippitts.answercoach.domain;

import java.util.List;
import java.util.Objects;

/**
 * Discrete assertion extracted from speech by the claim-matching strategy.
 * Recomputed every cycle and never stored in the session.
 *
 * @param text            claim text
 * @param entities        entities mentioned (may be empty)
 * @param predicate       relation asserted (may be null)
 * @param matchedBulletId best-matching bullet, null until matched
 * @param score           similarity to the matched bullet in [0,1]; 0 until matched
 */
public record Claim(String text, List<String> entities, String predicate, String matchedBulletId, double score) {

    public Claim {
        Objects.requireNonNull(text, "text");
        entities = entities == null ? List.of() : List.copyOf(entities);
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got: " + score);
        }
    }

    public static Claim of(String text) {
        return new Claim(text, List.of(), null, null, 0.0);
    }

    public Claim withMatch(String bulletId, double matchScore) {
        return new Claim(text, entities, predicate, bulletId, matchScore);
    }
}
