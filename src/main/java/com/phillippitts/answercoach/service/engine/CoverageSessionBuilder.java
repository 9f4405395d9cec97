package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.QuestionDefinition;
import com.phillippitts.answercoach.service.coverage.CoverageStrategy;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import com.phillippitts.answercoach.service.oracle.ConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.PhrasingOracle;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Builder for {@link CoverageSession}.
 *
 * <pre>{@code
 * CoverageSession session = CoverageSessionBuilder.builder()
 *     .question(question)
 *     .strategy(strategy)
 *     .invoker(invoker)
 *     .confidenceOracle(confidenceOracle)
 *     .phrasingOracle(phrasingOracle)
 *     .settings(settings)
 *     .clock(clock)
 *     .build();
 * }</pre>
 *
 * <p>Optional parts default to: random session id, {@link SessionSettings#defaults()}, template
 * phrasing, system UTC clock, {@link CoverageMetricsPublisher#NOOP} and an event publisher that
 * drops events.
 *
 * @since 1.0
 */
public final class CoverageSessionBuilder {

    // Required
    private QuestionDefinition question;
    private CoverageStrategy strategy;
    private OracleInvoker invoker;
    private ConfidenceOracle confidenceOracle;

    // Optional
    private UUID sessionId;
    private SessionSettings settings;
    private PhrasingOracle phrasingOracle;
    private Clock clock;
    private CoverageMetricsPublisher metrics;
    private ApplicationEventPublisher publisher;

    private CoverageSessionBuilder() {
        // Private constructor - use builder() factory method
    }

    public static CoverageSessionBuilder builder() {
        return new CoverageSessionBuilder();
    }

    public CoverageSessionBuilder question(QuestionDefinition question) {
        this.question = question;
        return this;
    }

    public CoverageSessionBuilder strategy(CoverageStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public CoverageSessionBuilder invoker(OracleInvoker invoker) {
        this.invoker = invoker;
        return this;
    }

    public CoverageSessionBuilder confidenceOracle(ConfidenceOracle confidenceOracle) {
        this.confidenceOracle = confidenceOracle;
        return this;
    }

    public CoverageSessionBuilder sessionId(UUID sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public CoverageSessionBuilder settings(SessionSettings settings) {
        this.settings = settings;
        return this;
    }

    public CoverageSessionBuilder phrasingOracle(PhrasingOracle phrasingOracle) {
        this.phrasingOracle = phrasingOracle;
        return this;
    }

    public CoverageSessionBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public CoverageSessionBuilder metrics(CoverageMetricsPublisher metrics) {
        this.metrics = metrics;
        return this;
    }

    public CoverageSessionBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @return a new active session
     * @throws NullPointerException if a required part is missing
     * @throws com.phillippitts.answercoach.exception.ConfigurationException if the bullets are invalid
     */
    public CoverageSession build() {
        Objects.requireNonNull(question, "question is required");
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(invoker, "invoker is required");
        Objects.requireNonNull(confidenceOracle, "confidenceOracle is required");
        return new CoverageSession(this);
    }

    UUID sessionId() {
        return sessionId != null ? sessionId : UUID.randomUUID();
    }

    QuestionDefinition question() {
        return question;
    }

    CoverageStrategy strategy() {
        return strategy;
    }

    OracleInvoker invoker() {
        return invoker;
    }

    ConfidenceOracle confidenceOracle() {
        return confidenceOracle;
    }

    SessionSettings settings() {
        return settings != null ? settings : SessionSettings.defaults();
    }

    PhrasingOracle phrasingOracle() {
        return phrasingOracle != null ? phrasingOracle : (target, uncovered) -> PhrasingOracle.fallback(target);
    }

    Clock clock() {
        return clock != null ? clock : Clock.systemUTC();
    }

    CoverageMetricsPublisher metrics() {
        return metrics != null ? metrics : CoverageMetricsPublisher.NOOP;
    }

    ApplicationEventPublisher publisher() {
        return publisher != null ? publisher : event -> { };
    }
}
