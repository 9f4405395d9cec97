package com.phillippitts.answercoach.service.oracle.gemini;

import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.oracle.OracleNames;
import com.phillippitts.answercoach.service.oracle.SimilarityMatch;
import com.phillippitts.answercoach.service.oracle.SimilarityMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Similarity matcher using Gemini embeddings and cosine similarity, clamped to [0,1].
 * Claims and bullets are embedded in one batch.
 */
public final class GeminiEmbeddingSimilarityMatcher implements SimilarityMatcher {

    private final GeminiClient client;

    public GeminiEmbeddingSimilarityMatcher(GeminiClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public List<SimilarityMatch> bestMatch(List<String> claimTexts, List<String> bulletTexts) {
        if (claimTexts.isEmpty()) {
            return List.of();
        }
        if (bulletTexts.isEmpty()) {
            throw new OracleUnavailableException("no bullets to match against", OracleNames.SIMILARITY);
        }
        List<String> all = new ArrayList<>(claimTexts.size() + bulletTexts.size());
        all.addAll(claimTexts);
        all.addAll(bulletTexts);
        List<double[]> vectors = client.embed(OracleNames.SIMILARITY, all);

        List<double[]> bullets = vectors.subList(claimTexts.size(), vectors.size());
        List<SimilarityMatch> out = new ArrayList<>(claimTexts.size());
        for (int c = 0; c < claimTexts.size(); c++) {
            double[] claim = vectors.get(c);
            int best = 0;
            double bestScore = -1.0;
            for (int b = 0; b < bullets.size(); b++) {
                double score = cosine(claim, bullets.get(b));
                if (score > bestScore) {
                    best = b;
                    bestScore = score;
                }
            }
            out.add(new SimilarityMatch(best, Math.max(0.0, Math.min(1.0, bestScore))));
        }
        return out;
    }

    static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new OracleUnavailableException("embedding dimensions differ", OracleNames.SIMILARITY);
        }
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
