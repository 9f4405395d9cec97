package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.domain.FollowupRecord;

import java.util.List;
import java.util.Optional;

/**
 * What one evaluation cycle did.
 *
 * @param cycle      1-based cycle number within the session
 * @param confidence confidence verdict used (KNOWS when unavailable)
 * @param bullets    bullet states after the cycle
 * @param followup   follow-up emitted, null if none
 * @param noop       true when no coverage classification was usable and nothing changed
 */
public record CycleOutcome(int cycle, ConfidenceVerdict confidence, List<BulletSnapshot> bullets,
                           FollowupRecord followup, boolean noop) {

    public CycleOutcome {
        bullets = List.copyOf(bullets);
    }

    public Optional<FollowupRecord> followupRecord() {
        return Optional.ofNullable(followup);
    }
}
