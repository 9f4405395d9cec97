package com.phillippitts.answercoach.service.oracle;

/**
 * Best bullet for one claim.
 *
 * @param bulletIndex index into the bullet list passed to the matcher
 * @param score       similarity in [0,1]
 */
public record SimilarityMatch(int bulletIndex, double score) {

    public SimilarityMatch {
        if (bulletIndex < 0) {
            throw new IllegalArgumentException("bulletIndex must be >= 0, got: " + bulletIndex);
        }
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got: " + score);
        }
    }
}
