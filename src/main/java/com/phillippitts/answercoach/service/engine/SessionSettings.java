package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.exception.ConfigurationException;

import java.time.Duration;

/**
 * Timing policy of one session.
 *
 * @param evaluationInterval time trigger of the transcript buffer
 * @param fragmentThreshold  count trigger of the transcript buffer
 * @param followupCooldown   minimum gap between two follow-ups on the same bullet
 */
public record SessionSettings(Duration evaluationInterval, int fragmentThreshold, Duration followupCooldown) {

    public static final Duration DEFAULT_EVALUATION_INTERVAL = Duration.ofSeconds(20);
    public static final int DEFAULT_FRAGMENT_THRESHOLD = 3;
    public static final Duration DEFAULT_FOLLOWUP_COOLDOWN = Duration.ofSeconds(30);

    public SessionSettings {
        if (evaluationInterval == null || evaluationInterval.isZero() || evaluationInterval.isNegative()) {
            throw new ConfigurationException("coverage.evaluation-interval-ms",
                    "evaluation interval must be positive, got: " + evaluationInterval);
        }
        if (fragmentThreshold < 1) {
            throw new ConfigurationException("coverage.fragment-threshold",
                    "fragment threshold must be >= 1, got: " + fragmentThreshold);
        }
        if (followupCooldown == null || followupCooldown.isZero() || followupCooldown.isNegative()) {
            throw new ConfigurationException("coverage.followup-cooldown-ms",
                    "follow-up cooldown must be positive, got: " + followupCooldown);
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(DEFAULT_EVALUATION_INTERVAL, DEFAULT_FRAGMENT_THRESHOLD, DEFAULT_FOLLOWUP_COOLDOWN);
    }
}
