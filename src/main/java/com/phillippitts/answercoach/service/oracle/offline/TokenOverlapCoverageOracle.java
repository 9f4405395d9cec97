package com.phillippitts.answercoach.service.oracle.offline;

import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.domain.TranscriptEntry;
import com.phillippitts.answercoach.service.oracle.CoverageOracle;
import com.phillippitts.answercoach.util.TokenizerUtil;

import java.util.Set;

/**
 * Offline coverage classifier: the share of a bullet's content words that the speaker used.
 *
 * <p>Follow-up lines of the answer are ignored, since they quote the bullet itself.
 * A share of at least {@code coveredRatio} is {@code COVERED}, at least {@code partialRatio} is
 * {@code PARTIAL}, anything less is {@code INCOMPLETE}.
 */
public final class TokenOverlapCoverageOracle implements CoverageOracle {

    public static final double DEFAULT_COVERED_RATIO = 0.8;
    public static final double DEFAULT_PARTIAL_RATIO = 0.4;

    private final double coveredRatio;
    private final double partialRatio;

    public TokenOverlapCoverageOracle() {
        this(DEFAULT_COVERED_RATIO, DEFAULT_PARTIAL_RATIO);
    }

    public TokenOverlapCoverageOracle(double coveredRatio, double partialRatio) {
        if (partialRatio < 0.0 || coveredRatio > 1.0 || partialRatio > coveredRatio) {
            throw new IllegalArgumentException("need 0 <= partialRatio <= coveredRatio <= 1");
        }
        this.coveredRatio = coveredRatio;
        this.partialRatio = partialRatio;
    }

    @Override
    public CoverageVerdict classify(String bulletText, String fullAnswerText) {
        double ratio = overlap(bulletText, speakerText(fullAnswerText));
        if (ratio >= coveredRatio) {
            return CoverageVerdict.COVERED;
        }
        return ratio >= partialRatio ? CoverageVerdict.PARTIAL : CoverageVerdict.INCOMPLETE;
    }

    /**
     * Share of the bullet's content tokens found in the answer.
     */
    static double overlap(String bulletText, String answerText) {
        Set<String> bullet = TokenizerUtil.contentTokens(bulletText);
        if (bullet.isEmpty()) {
            return 0.0;
        }
        Set<String> answer = Set.copyOf(TokenizerUtil.tokenize(answerText));
        long hits = bullet.stream().filter(answer::contains).count();
        return hits / (double) bullet.size();
    }

    static String speakerText(String fullAnswerText) {
        return TranscriptEntry.speakerText(fullAnswerText);
    }
}
