package com.phillippitts.answercoach.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe front for {@link CoverageMetrics} used by the engine and the oracle invoker.
 *
 * <p>Sessions and oracle calls record through this publisher so they can run without a
 * {@link io.micrometer.core.instrument.MeterRegistry} in unit tests.
 *
 * @since 1.0
 * @see CoverageMetrics
 */
@Component
public final class CoverageMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(CoverageMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and builder defaults. Never throws, records nothing.
     */
    public static final CoverageMetricsPublisher NOOP = new CoverageMetricsPublisher(null);

    public static final String CYCLE_FOLLOWUP = "followup";
    public static final String CYCLE_NONE = "none";
    public static final String CYCLE_NOOP = "noop";

    private final CoverageMetrics metrics;

    /**
     * Constructs a metrics publisher with optional metrics support.
     *
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public CoverageMetricsPublisher(CoverageMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("CoverageMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordOracleSuccess(String oracle, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordOracleLatency(oracle, durationNanos);
    }

    public void recordOracleFailure(String oracle, long durationNanos, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.recordOracleLatency(oracle, durationNanos);
        metrics.incrementOracleFailure(oracle, reason);
    }

    public void recordCycle(String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordCycle(outcome, durationNanos);
    }

    public void recordSequenceGap() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSequenceGap();
    }

    public void recordScore(double score) {
        if (metrics == null) {
            return;
        }
        metrics.recordScore(score);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
