package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.Bullet;
import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.BulletState;
import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.exception.ConfigurationException;
import com.phillippitts.answercoach.service.coverage.CoverageAssessment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the coverage state of every bullet of one session and applies the per-cycle transition rules.
 *
 * <p><b>Transition rules</b>, evaluated once per cycle for each non-terminal bullet, first match wins:
 * <ol>
 *   <li>Coverage verdict {@code COVERED} sets {@link BulletState#COVERED}. The bullet is frozen.</li>
 *   <li>Follow-up outstanding for the bullet and confidence {@code DOES_NOT_KNOW} sets
 *       {@link BulletState#SKIPPED}. Also frozen.</li>
 *   <li>Follow-up outstanding and confidence {@code UNCERTAIN} sets {@link BulletState#PENDING}.</li>
 *   <li>Follow-up outstanding and confidence {@code KNOWS} restores the bullet's most recent
 *       classification ({@code PARTIAL}, {@code INCOMPLETE} or {@code UNCOVERED}).</li>
 *   <li>Otherwise the state is the raw verdict.</li>
 * </ol>
 *
 * <p>A degraded assessment can never cover a bullet and never overwrites the last classification;
 * without an outstanding follow-up the bullet keeps its prior state.
 *
 * <p><b>Thread Safety:</b> not thread-safe. Mutated only by the session's evaluation cycle under
 * its cycle lock; read by others through immutable {@link BulletSnapshot}s.
 *
 * @since 1.0
 */
public final class BulletStateMachine {

    private static final Logger LOG = LogManager.getLogger(BulletStateMachine.class);

    private final Map<String, TrackedBullet> bullets = new LinkedHashMap<>();

    /**
     * @param declared bullets in declaration order (may be empty)
     * @throws ConfigurationException on a blank or duplicate id or blank text
     */
    public BulletStateMachine(List<Bullet> declared) {
        Objects.requireNonNull(declared, "declared");
        for (Bullet bullet : declared) {
            if (bullet == null || bullet.id() == null || bullet.id().isBlank()) {
                throw new ConfigurationException("bullets", "bullet id must not be blank");
            }
            if (bullet.text() == null || bullet.text().isBlank()) {
                throw new ConfigurationException("bullets", "bullet '" + bullet.id() + "' has blank text");
            }
            if (bullets.putIfAbsent(bullet.id(), new TrackedBullet(bullet)) != null) {
                throw new ConfigurationException("bullets", "duplicate bullet id '" + bullet.id() + "'");
            }
        }
    }

    /**
     * Applies the transition rules to one bullet.
     *
     * @param bulletId            bullet to update
     * @param assessment          this cycle's coverage assessment
     * @param confidence          this cycle's confidence verdict
     * @param followupOutstanding whether the previous cycle's follow-up targeted this bullet
     * @return the resulting state
     */
    public BulletState transition(String bulletId, CoverageAssessment assessment, ConfidenceVerdict confidence,
                                  boolean followupOutstanding) {
        TrackedBullet tracked = require(bulletId);
        Objects.requireNonNull(assessment, "assessment");
        Objects.requireNonNull(confidence, "confidence");
        if (tracked.state.isTerminal()) {
            return tracked.state;
        }
        if (assessment.score() != null) {
            tracked.bestMatchScore = tracked.bestMatchScore == null
                    ? assessment.score() : Math.max(tracked.bestMatchScore, assessment.score());
        }

        BulletState before = tracked.state;
        CoverageVerdict verdict = assessment.verdict();
        boolean usable = !assessment.degraded();

        if (usable && verdict == CoverageVerdict.COVERED) {
            tracked.lastVerdict = CoverageVerdict.COVERED;
            tracked.state = BulletState.COVERED;
        } else {
            tracked.lastVerdict = usable ? verdict : CoverageVerdict.INCOMPLETE;
            if (usable) {
                tracked.lastClassification = verdict.toState();
            }
            if (followupOutstanding) {
                tracked.state = switch (confidence) {
                    case DOES_NOT_KNOW -> BulletState.SKIPPED;
                    case UNCERTAIN -> BulletState.PENDING;
                    case KNOWS -> tracked.lastClassification;
                };
            } else if (usable) {
                tracked.state = verdict.toState();
            }
        }

        if (before != tracked.state) {
            LOG.debug("Bullet {}: {} -> {} (verdict={}, confidence={}, outstanding={})",
                    bulletId, before, tracked.state, verdict, confidence, followupOutstanding);
        }
        return tracked.state;
    }

    /**
     * Records that a follow-up now targets the bullet: state {@code PENDING}, cooldown stamped.
     */
    public void markFollowupIssued(String bulletId, Instant at) {
        TrackedBullet tracked = require(bulletId);
        if (tracked.state.isTerminal()) {
            throw new IllegalStateException("Bullet " + bulletId + " is " + tracked.state);
        }
        tracked.state = BulletState.PENDING;
        tracked.lastFollowupAt = Objects.requireNonNull(at, "at");
    }

    public BulletSnapshot snapshot(String bulletId) {
        return require(bulletId).snapshot();
    }

    /**
     * All bullets, declaration order.
     */
    public List<BulletSnapshot> snapshots() {
        List<BulletSnapshot> out = new ArrayList<>(bullets.size());
        for (TrackedBullet tracked : bullets.values()) {
            out.add(tracked.snapshot());
        }
        return out;
    }

    /**
     * Non-terminal bullets, declaration order.
     */
    public List<BulletSnapshot> activeSnapshots() {
        List<BulletSnapshot> out = new ArrayList<>();
        for (TrackedBullet tracked : bullets.values()) {
            if (!tracked.state.isTerminal()) {
                out.add(tracked.snapshot());
            }
        }
        return out;
    }

    public int size() {
        return bullets.size();
    }

    public int count(BulletState state) {
        int n = 0;
        for (TrackedBullet tracked : bullets.values()) {
            if (tracked.state == state) {
                n++;
            }
        }
        return n;
    }

    private TrackedBullet require(String bulletId) {
        TrackedBullet tracked = bullets.get(bulletId);
        if (tracked == null) {
            throw new IllegalArgumentException("Unknown bullet: " + bulletId);
        }
        return tracked;
    }

    private static final class TrackedBullet {
        private final Bullet bullet;
        private BulletState state = BulletState.UNCOVERED;
        private CoverageVerdict lastVerdict = CoverageVerdict.UNCOVERED;
        // Latest usable non-covered verdict as a state, restored when a follow-up gets a confident answer
        private BulletState lastClassification = BulletState.UNCOVERED;
        private Instant lastFollowupAt;
        private Double bestMatchScore;

        TrackedBullet(Bullet bullet) {
            this.bullet = bullet;
        }

        BulletSnapshot snapshot() {
            return new BulletSnapshot(bullet, state, lastVerdict, lastFollowupAt, bestMatchScore);
        }
    }
}
