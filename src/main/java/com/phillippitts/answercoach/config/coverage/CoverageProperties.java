package com.phillippitts.answercoach.config.coverage;

import com.phillippitts.answercoach.exception.ConfigurationException;
import com.phillippitts.answercoach.service.engine.SessionSettings;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "coverage")
public class CoverageProperties {

    public enum Strategy { CLASSIFIER, CLAIM_MATCHING }

    /** How bullets are judged each cycle. */
    @NotNull
    private final Strategy strategy;

    /** Evaluate buffered speech when more than this many ms passed since the last cycle. */
    private final long evaluationIntervalMs;

    /** Evaluate as soon as this many fragments are buffered. */
    private final int fragmentThreshold;

    /** Minimum ms between two follow-ups on the same bullet. */
    private final long followupCooldownMs;

    /** Similarity score (0..1] at which a bullet counts as covered under claim matching. */
    private final double presentThreshold;

    /** Ask the binary classifier about bullets below the present threshold (claim matching only). */
    private final boolean binaryBackstop;

    /** Evaluate still-buffered speech when a session is finalized. */
    private final boolean flushOnFinalize;

    /** How long a transcript pump waits for a fragment before checking the time trigger. */
    private final long pumpPollMs;

    /** Finalized sessions kept queryable. */
    private final int retainFinalized;

    @ConstructorBinding
    public CoverageProperties(Strategy strategy, Long evaluationIntervalMs, Integer fragmentThreshold,
                              Long followupCooldownMs, Double presentThreshold, Boolean binaryBackstop,
                              Boolean flushOnFinalize, Long pumpPollMs, Integer retainFinalized) {
        this.strategy = strategy == null ? Strategy.CLASSIFIER : strategy;

        this.evaluationIntervalMs = evaluationIntervalMs == null ? 20_000 : evaluationIntervalMs;
        if (this.evaluationIntervalMs <= 0) {
            throw new ConfigurationException("coverage.evaluation-interval-ms", "must be > 0");
        }
        this.fragmentThreshold = fragmentThreshold == null ? 3 : fragmentThreshold;
        if (this.fragmentThreshold < 1) {
            throw new ConfigurationException("coverage.fragment-threshold", "must be >= 1");
        }
        this.followupCooldownMs = followupCooldownMs == null ? 30_000 : followupCooldownMs;
        if (this.followupCooldownMs <= 0) {
            throw new ConfigurationException("coverage.followup-cooldown-ms", "must be > 0");
        }
        double t = presentThreshold == null ? 0.75 : presentThreshold;
        if (t <= 0.0 || t > 1.0) {
            throw new ConfigurationException("coverage.present-threshold", "must be in (0,1]");
        }
        this.presentThreshold = t;
        this.binaryBackstop = binaryBackstop == null ? true : binaryBackstop;
        this.flushOnFinalize = flushOnFinalize == null ? true : flushOnFinalize;
        this.pumpPollMs = pumpPollMs == null ? 1_000 : pumpPollMs;
        if (this.pumpPollMs <= 0) {
            throw new ConfigurationException("coverage.pump-poll-ms", "must be > 0");
        }
        this.retainFinalized = retainFinalized == null ? 100 : retainFinalized;
        if (this.retainFinalized < 0) {
            throw new ConfigurationException("coverage.retain-finalized", "must be >= 0");
        }
    }

    /**
     * Timing policy handed to every new session.
     */
    public SessionSettings toSessionSettings() {
        return new SessionSettings(Duration.ofMillis(evaluationIntervalMs), fragmentThreshold,
                Duration.ofMillis(followupCooldownMs));
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public long getEvaluationIntervalMs() {
        return evaluationIntervalMs;
    }

    public int getFragmentThreshold() {
        return fragmentThreshold;
    }

    public long getFollowupCooldownMs() {
        return followupCooldownMs;
    }

    public double getPresentThreshold() {
        return presentThreshold;
    }

    public boolean isBinaryBackstop() {
        return binaryBackstop;
    }

    public boolean isFlushOnFinalize() {
        return flushOnFinalize;
    }

    public long getPumpPollMs() {
        return pumpPollMs;
    }

    public int getRetainFinalized() {
        return retainFinalized;
    }
}
