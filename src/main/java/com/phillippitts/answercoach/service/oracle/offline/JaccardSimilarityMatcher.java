package com.phillippitts.answercoach.service.oracle.offline;

import com.phillippitts.answercoach.service.oracle.SimilarityMatch;
import com.phillippitts.answercoach.service.oracle.SimilarityMatcher;
import com.phillippitts.answercoach.util.TokenizerUtil;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Offline similarity matcher using Jaccard overlap of content tokens.
 *
 * <p>Jaccard similarity = |A ∩ B| / |A ∪ B|. Ties go to the earlier bullet.
 */
public final class JaccardSimilarityMatcher implements SimilarityMatcher {

    @Override
    public List<SimilarityMatch> bestMatch(List<String> claimTexts, List<String> bulletTexts) {
        if (bulletTexts.isEmpty() && !claimTexts.isEmpty()) {
            throw new IllegalArgumentException("no bullets to match against");
        }
        List<Set<String>> bullets = new ArrayList<>(bulletTexts.size());
        for (String bullet : bulletTexts) {
            bullets.add(TokenizerUtil.contentTokens(bullet));
        }
        List<SimilarityMatch> out = new ArrayList<>(claimTexts.size());
        for (String claim : claimTexts) {
            Set<String> tokens = TokenizerUtil.contentTokens(claim);
            int best = 0;
            double bestScore = -1.0;
            for (int i = 0; i < bullets.size(); i++) {
                double score = jaccard(tokens, bullets.get(i));
                if (score > bestScore) {
                    best = i;
                    bestScore = score;
                }
            }
            out.add(new SimilarityMatch(best, bestScore));
        }
        return out;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return intersection.size() / (double) union.size();
    }
}
