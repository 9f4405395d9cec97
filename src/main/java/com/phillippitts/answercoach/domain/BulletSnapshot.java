package com.phillippitts.answercoach.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one bullet's tracking state at a point in time.
 *
 * @param bullet         the bullet
 * @param state          current state
 * @param lastVerdict    coverage verdict from the most recent cycle (UNCOVERED before any cycle)
 * @param lastFollowupAt time of the last follow-up targeting this bullet, null if never
 * @param bestMatchScore highest similarity seen so far, null outside the claim-matching strategy
 */
public record BulletSnapshot(
        Bullet bullet,
        BulletState state,
        CoverageVerdict lastVerdict,
        Instant lastFollowupAt,
        Double bestMatchScore
) {

    public BulletSnapshot {
        Objects.requireNonNull(bullet, "bullet");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(lastVerdict, "lastVerdict");
    }

    public String id() {
        return bullet.id();
    }
}
