package com.phillippitts.answercoach.service.coverage;

import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.Claim;
import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.oracle.ClaimOracle;
import com.phillippitts.answercoach.service.oracle.CoverageOracle;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.OracleNames;
import com.phillippitts.answercoach.service.oracle.SimilarityMatch;
import com.phillippitts.answercoach.service.oracle.SimilarityMatcher;
import com.phillippitts.answercoach.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Judges coverage by extracting claims from the latest speech and scoring them against bullets.
 *
 * <p>Per cycle:
 * <ol>
 *   <li>Claims are extracted from the drained speaker text. If the extractor fails, sentences
 *       stand in for claims.</li>
 *   <li>The similarity matcher places every claim on its best bullet. A bullet's score is the best
 *       seen over the whole session, so evidence from earlier cycles is never lost.</li>
 *   <li>A bullet scoring at least the present threshold is covered. Otherwise the optional binary
 *       classifier gets a final say against the full answer.</li>
 * </ol>
 *
 * <p>Verdicts are binary: {@code COVERED} or {@code UNCOVERED}. A bullet is degraded only when
 * neither the matcher nor the backstop produced an answer.
 */
public final class ClaimMatchingCoverageStrategy implements CoverageStrategy {

    private static final Logger LOG = LogManager.getLogger(ClaimMatchingCoverageStrategy.class);

    private final OracleInvoker invoker;
    private final ClaimOracle claimOracle;
    private final SimilarityMatcher matcher;
    private final CoverageOracle backstop;
    private final double presentThreshold;

    /**
     * @param invoker          oracle runner
     * @param claimOracle      claim extractor
     * @param matcher          similarity matcher
     * @param backstop         binary classifier consulted below the threshold, or null for none
     * @param presentThreshold score at or above which a bullet counts as covered, in (0,1]
     */
    public ClaimMatchingCoverageStrategy(OracleInvoker invoker, ClaimOracle claimOracle, SimilarityMatcher matcher,
                                         CoverageOracle backstop, double presentThreshold) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.claimOracle = Objects.requireNonNull(claimOracle, "claimOracle");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.backstop = backstop == null ? null : CoverageOracle.binary(backstop);
        if (presentThreshold <= 0.0 || presentThreshold > 1.0) {
            throw new IllegalArgumentException("presentThreshold must be in (0,1], got: " + presentThreshold);
        }
        this.presentThreshold = presentThreshold;
    }

    @Override
    public Map<String, CoverageAssessment> assess(List<BulletSnapshot> active, String fullAnswerText,
                                                  String latestSpeakerText) {
        List<Claim> claims = extractClaims(latestSpeakerText);
        Optional<double[]> cycleScores = scoreClaims(claims, active);

        Map<String, Double> best = new LinkedHashMap<>();
        List<BulletSnapshot> undecided = new ArrayList<>();
        for (int i = 0; i < active.size(); i++) {
            BulletSnapshot snapshot = active.get(i);
            double previous = snapshot.bestMatchScore() == null ? 0.0 : snapshot.bestMatchScore();
            double now = cycleScores.isPresent() ? Math.max(previous, cycleScores.get()[i]) : previous;
            best.put(snapshot.id(), now);
            if (now < presentThreshold) {
                undecided.add(snapshot);
            }
        }

        Map<String, CoverageVerdict> backstopVerdicts = runBackstop(undecided, fullAnswerText);

        Map<String, CoverageAssessment> out = new LinkedHashMap<>();
        for (BulletSnapshot snapshot : active) {
            String id = snapshot.id();
            double score = best.get(id);
            CoverageAssessment assessment;
            if (score >= presentThreshold) {
                assessment = new CoverageAssessment(id, CoverageVerdict.COVERED, score, false);
            } else if (backstopVerdicts.containsKey(id)) {
                assessment = new CoverageAssessment(id, backstopVerdicts.get(id), score, false);
            } else if (cycleScores.isPresent()) {
                assessment = new CoverageAssessment(id, CoverageVerdict.UNCOVERED, score, false);
            } else {
                assessment = CoverageAssessment.degraded(id, score);
            }
            out.put(id, assessment);
            LOG.debug("Bullet {} -> {} (best score {}){}", id, assessment.verdict(),
                    String.format("%.2f", score), assessment.degraded() ? " (degraded)" : "");
        }
        return out;
    }

    @Override
    public String name() {
        return "claim-matching";
    }

    private List<Claim> extractClaims(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Optional<List<Claim>> extracted = invoker.invoke(OracleNames.CLAIM, () -> claimOracle.extract(text));
        if (extracted.isPresent()) {
            return extracted.get();
        }
        List<Claim> fallback = new ArrayList<>();
        for (String sentence : SentenceSplitter.split(text)) {
            fallback.add(Claim.of(sentence));
        }
        LOG.info("Claim extraction unavailable, using {} sentence(s) as claims", fallback.size());
        return fallback;
    }

    /**
     * Best score per active bullet from this cycle's claims, or empty if the matcher failed.
     */
    private Optional<double[]> scoreClaims(List<Claim> claims, List<BulletSnapshot> active) {
        double[] scores = new double[active.size()];
        if (claims.isEmpty() || active.isEmpty()) {
            return Optional.of(scores);
        }
        List<String> claimTexts = claims.stream().map(Claim::text).toList();
        List<String> bulletTexts = active.stream().map(s -> s.bullet().text()).toList();

        Optional<List<SimilarityMatch>> matches = invoker.invoke(OracleNames.SIMILARITY,
                () -> checkedMatch(claimTexts, bulletTexts));
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        for (int c = 0; c < claims.size(); c++) {
            SimilarityMatch match = matches.get().get(c);
            Claim matched = claims.get(c).withMatch(active.get(match.bulletIndex()).id(), match.score());
            scores[match.bulletIndex()] = Math.max(scores[match.bulletIndex()], matched.score());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Claim '{}' -> {} ({})", LogSanitizer.preview(matched.text(), 40),
                        matched.matchedBulletId(), String.format("%.2f", matched.score()));
            }
        }
        return Optional.of(scores);
    }

    private List<SimilarityMatch> checkedMatch(List<String> claimTexts, List<String> bulletTexts) {
        List<SimilarityMatch> matches = matcher.bestMatch(claimTexts, bulletTexts);
        if (matches == null || matches.size() != claimTexts.size()) {
            throw new OracleUnavailableException("expected " + claimTexts.size() + " matches, got "
                    + (matches == null ? "none" : matches.size()), OracleNames.SIMILARITY);
        }
        for (SimilarityMatch m : matches) {
            if (m.bulletIndex() >= bulletTexts.size()) {
                throw new OracleUnavailableException("bullet index out of range: " + m.bulletIndex(),
                        OracleNames.SIMILARITY);
            }
        }
        return matches;
    }

    private Map<String, CoverageVerdict> runBackstop(List<BulletSnapshot> undecided, String fullAnswerText) {
        if (backstop == null || undecided.isEmpty()) {
            return Map.of();
        }
        List<Supplier<CoverageVerdict>> calls = new ArrayList<>(undecided.size());
        for (BulletSnapshot snapshot : undecided) {
            String bulletText = snapshot.bullet().text();
            calls.add(() -> backstop.classify(bulletText, fullAnswerText));
        }
        List<Optional<CoverageVerdict>> verdicts = invoker.invokeAll(OracleNames.COVERAGE, calls);
        Map<String, CoverageVerdict> out = new LinkedHashMap<>();
        for (int i = 0; i < undecided.size(); i++) {
            String id = undecided.get(i).id();
            verdicts.get(i).ifPresent(v -> out.put(id, v));
        }
        return out;
    }
}
