package com.phillippitts.answercoach.service.coverage;

import com.phillippitts.answercoach.domain.BulletSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Pluggable way of judging bullet coverage for one evaluation cycle.
 *
 * <p>Implementations never throw for oracle trouble: a bullet whose oracle calls all failed is
 * returned as {@link CoverageAssessment#degraded(String, Double)}. The state machine and the
 * scheduler only see the resulting verdicts, so they do not depend on the strategy in use.
 *
 * <p>Implementations hold no per-session state; anything that must survive between cycles
 * (such as the best similarity score) travels in the {@link BulletSnapshot}s.
 */
public interface CoverageStrategy {

    /**
     * @param active            non-terminal bullets, declaration order
     * @param fullAnswerText    reconstructed answer including tagged follow-ups
     * @param latestSpeakerText speaker text drained this cycle
     * @return one assessment per active bullet, keyed by bullet id
     */
    Map<String, CoverageAssessment> assess(List<BulletSnapshot> active, String fullAnswerText, String latestSpeakerText);

    /**
     * Short name for logs.
     */
    String name();
}
