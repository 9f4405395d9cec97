package com.phillippitts.answercoach.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for coverage evaluation.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Oracle call latency and failures per oracle (coverage, confidence, claim, similarity, phrasing)</li>
 *   <li>Evaluation cycles by outcome (follow-ups counted as {@code outcome=followup}) and their duration</li>
 *   <li>Sequence gaps seen and final session scores</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class CoverageMetrics {

    private static final String METRIC_PREFIX = "answercoach";

    private final MeterRegistry registry;

    public CoverageMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of a single oracle call, successful or not.
     *
     * @param oracle oracle name
     * @param durationNanos duration in nanoseconds
     */
    public void recordOracleLatency(String oracle, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".oracle.latency")
                .description("Time taken by external oracle calls")
                .tag("oracle", oracle)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the failure counter for an oracle.
     *
     * @param oracle oracle name
     * @param reason failure reason (timeout, unavailable, unexpected)
     */
    public void incrementOracleFailure(String oracle, String reason) {
        Counter.builder(METRIC_PREFIX + ".oracle.failure")
                .description("Number of oracle calls that fell back to the degraded answer")
                .tag("oracle", oracle)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records one evaluation cycle.
     *
     * @param outcome followup, none or noop
     * @param durationNanos cycle duration in nanoseconds
     */
    public void recordCycle(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".cycle")
                .description("Evaluation cycles by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSequenceGap() {
        Counter.builder(METRIC_PREFIX + ".transcript.sequence_gap")
                .description("Fragments that arrived with a gap or out of order")
                .register(registry)
                .increment();
    }

    /**
     * Records the final score of a session.
     *
     * @param score percentage in [0,100]
     */
    public void recordScore(double score) {
        DistributionSummary.builder(METRIC_PREFIX + ".session.score")
                .description("Final coverage score of finalized sessions")
                .baseUnit("percent")
                .register(registry)
                .record(score);
    }
}
