package com.phillippitts.answercoach.service.oracle;

import com.phillippitts.answercoach.domain.Claim;

import java.util.List;

/**
 * External extractor of discrete claims from a stretch of speech.
 */
@FunctionalInterface
public interface ClaimOracle {

    /**
     * @param fragmentText speaker text to analyse
     * @return claims in the order they were made; unmatched (no bullet, score 0)
     */
    List<Claim> extract(String fragmentText);
}
