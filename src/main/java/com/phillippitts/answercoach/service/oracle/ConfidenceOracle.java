package com.phillippitts.answercoach.service.oracle;

import com.phillippitts.answercoach.domain.ConfidenceVerdict;

/**
 * External classifier of the speaker's certainty in their most recent speech.
 */
@FunctionalInterface
public interface ConfidenceOracle {

    /**
     * @param latestFragmentText speaker text drained in the current cycle (no follow-up text)
     * @return confidence verdict
     */
    ConfidenceVerdict classify(String latestFragmentText);
}
