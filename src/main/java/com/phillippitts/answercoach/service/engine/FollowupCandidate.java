package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.Bullet;

import java.util.List;
import java.util.Objects;

/**
 * Bullet chosen for the next follow-up, with the context a phrasing oracle needs.
 *
 * @param target             bullet to ask about
 * @param uncoveredBulletTexts texts of every bullet that is neither covered nor skipped
 */
public record FollowupCandidate(Bullet target, List<String> uncoveredBulletTexts) {

    public FollowupCandidate {
        Objects.requireNonNull(target, "target");
        uncoveredBulletTexts = List.copyOf(uncoveredBulletTexts);
    }
}
