package com.phillippitts.answercoach.service.coverage;

import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.service.oracle.CoverageOracle;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.OracleNames;
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
 * Asks the ternary coverage classifier about every active bullet against the full answer.
 *
 * <p>All bullets are classified in parallel under one deadline. A bullet whose call failed is
 * degraded on its own; the other bullets keep their verdicts.
 */
public final class ClassifierCoverageStrategy implements CoverageStrategy {

    private static final Logger LOG = LogManager.getLogger(ClassifierCoverageStrategy.class);

    private final OracleInvoker invoker;
    private final CoverageOracle oracle;

    public ClassifierCoverageStrategy(OracleInvoker invoker, CoverageOracle oracle) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    @Override
    public Map<String, CoverageAssessment> assess(List<BulletSnapshot> active, String fullAnswerText,
                                                  String latestSpeakerText) {
        List<Supplier<CoverageVerdict>> calls = new ArrayList<>(active.size());
        for (BulletSnapshot snapshot : active) {
            String bulletText = snapshot.bullet().text();
            calls.add(() -> oracle.classify(bulletText, fullAnswerText));
        }
        List<Optional<CoverageVerdict>> verdicts = invoker.invokeAll(OracleNames.COVERAGE, calls);

        Map<String, CoverageAssessment> out = new LinkedHashMap<>();
        for (int i = 0; i < active.size(); i++) {
            String id = active.get(i).id();
            CoverageAssessment assessment = verdicts.get(i)
                    .map(v -> CoverageAssessment.of(id, v))
                    .orElseGet(() -> CoverageAssessment.degraded(id, null));
            out.put(id, assessment);
            LOG.debug("Bullet {} -> {}{}", id, assessment.verdict(), assessment.degraded() ? " (degraded)" : "");
        }
        return out;
    }

    @Override
    public String name() {
        return "classifier";
    }
}
