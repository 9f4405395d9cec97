package com.phillippitts.answercoach.service.coverage;

import com.phillippitts.answercoach.domain.CoverageVerdict;

import java.util.Objects;

/**
 * Outcome of assessing one bullet in one evaluation cycle.
 *
 * @param bulletId bullet assessed
 * @param verdict  coverage verdict; {@code INCOMPLETE} when degraded
 * @param score    best similarity score known for the bullet, null outside claim matching
 * @param degraded true when no oracle produced a usable answer for this bullet
 */
public record CoverageAssessment(String bulletId, CoverageVerdict verdict, Double score, boolean degraded) {

    public CoverageAssessment {
        Objects.requireNonNull(bulletId, "bulletId");
        Objects.requireNonNull(verdict, "verdict");
    }

    public static CoverageAssessment of(String bulletId, CoverageVerdict verdict) {
        return new CoverageAssessment(bulletId, verdict, null, false);
    }

    /**
     * Conservative assessment used when every oracle call for the bullet failed.
     */
    public static CoverageAssessment degraded(String bulletId, Double score) {
        return new CoverageAssessment(bulletId, CoverageVerdict.INCOMPLETE, score, true);
    }
}
