package com.phillippitts.answercoach.service.oracle;

import java.util.List;

/**
 * External scorer aligning claims with bullets.
 */
@FunctionalInterface
public interface SimilarityMatcher {

    /**
     * @param claimTexts  claims to place
     * @param bulletTexts candidate bullets (non-empty when claims are non-empty)
     * @return one match per claim, same order as {@code claimTexts}
     */
    List<SimilarityMatch> bestMatch(List<String> claimTexts, List<String> bulletTexts);
}
