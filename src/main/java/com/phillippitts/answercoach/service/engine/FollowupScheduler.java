package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decides which bullet, if any, the next follow-up targets.
 *
 * <p>Candidates are ranked in two tiers, each in declaration order: bullets whose latest verdict
 * was {@code PARTIAL}, then bullets judged {@code INCOMPLETE} or {@code UNCOVERED}. Covered and
 * skipped bullets never appear. The first candidate passing {@link #eligibility(String, Instant)}
 * wins and is marked pending; when none passes the cycle simply has no follow-up.
 *
 * <p>Wording is not decided here; see {@link com.phillippitts.answercoach.service.oracle.PhrasingOracle}.
 *
 * @since 1.0
 */
public final class FollowupScheduler {

    private static final Logger LOG = LogManager.getLogger(FollowupScheduler.class);

    private final Duration cooldown;

    public FollowupScheduler(Duration cooldown) {
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
    }

    /**
     * Selects at most one follow-up target and marks it issued.
     *
     * @param machine              bullet states of the session
     * @param lastFollowupBulletId bullet targeted by the previous cycle's follow-up, or null
     * @param now                  cycle time
     * @return the chosen candidate, or empty
     */
    public Optional<FollowupCandidate> selectFollowup(BulletStateMachine machine, String lastFollowupBulletId,
                                                      Instant now) {
        List<BulletSnapshot> ranked = rankCandidates(machine.snapshots());
        Predicate<BulletSnapshot> eligible = eligibility(lastFollowupBulletId, now);
        for (BulletSnapshot candidate : ranked) {
            if (eligible.test(candidate)) {
                machine.markFollowupIssued(candidate.id(), now);
                LOG.debug("Follow-up target {} (verdict {})", candidate.id(), candidate.lastVerdict());
                return Optional.of(new FollowupCandidate(candidate.bullet(), uncoveredTexts(machine)));
            }
        }
        LOG.debug("No eligible follow-up among {} candidate(s)", ranked.size());
        return Optional.empty();
    }

    /**
     * Partial tier first, then incomplete or uncovered, declaration order within each tier.
     */
    public List<BulletSnapshot> rankCandidates(List<BulletSnapshot> bullets) {
        List<BulletSnapshot> partial = new ArrayList<>();
        List<BulletSnapshot> rest = new ArrayList<>();
        for (BulletSnapshot s : bullets) {
            if (s.state().isTerminal()) {
                continue;
            }
            if (s.lastVerdict() == CoverageVerdict.PARTIAL) {
                partial.add(s);
            } else if (s.lastVerdict() != CoverageVerdict.COVERED) {
                rest.add(s);
            }
        }
        partial.addAll(rest);
        return partial;
    }

    /**
     * All three selection conditions combined.
     */
    public Predicate<BulletSnapshot> eligibility(String lastFollowupBulletId, Instant now) {
        return acceptsFollowup()
                .and(notRepeatOf(lastFollowupBulletId))
                .and(cooledDown(now));
    }

    static Predicate<BulletSnapshot> acceptsFollowup() {
        return s -> s.state().acceptsFollowup();
    }

    static Predicate<BulletSnapshot> notRepeatOf(String lastFollowupBulletId) {
        return s -> lastFollowupBulletId == null || !lastFollowupBulletId.equals(s.id());
    }

    Predicate<BulletSnapshot> cooledDown(Instant now) {
        return s -> TimeUtils.exceeds(s.lastFollowupAt(), now, cooldown);
    }

    private static List<String> uncoveredTexts(BulletStateMachine machine) {
        List<String> texts = new ArrayList<>();
        for (BulletSnapshot s : machine.snapshots()) {
            if (!s.state().isTerminal()) {
                texts.add(s.bullet().text());
            }
        }
        return texts;
    }
}
