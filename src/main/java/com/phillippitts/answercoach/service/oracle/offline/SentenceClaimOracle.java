package com.phillippitts.answercoach.service.oracle.offline;

import com.phillippitts.answercoach.domain.Claim;
import com.phillippitts.answercoach.service.coverage.SentenceSplitter;
import com.phillippitts.answercoach.service.oracle.ClaimOracle;

import java.util.List;

/**
 * Offline claim extractor: every sentence is a claim, without entities or predicate.
 */
public final class SentenceClaimOracle implements ClaimOracle {

    @Override
    public List<Claim> extract(String fragmentText) {
        return SentenceSplitter.split(fragmentText).stream().map(Claim::of).toList();
    }
}
