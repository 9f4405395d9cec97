package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.QuestionDefinition;
import com.phillippitts.answercoach.service.coverage.CoverageStrategy;
import com.phillippitts.answercoach.service.engine.CoverageSession;
import com.phillippitts.answercoach.service.engine.CoverageSessionBuilder;
import com.phillippitts.answercoach.service.engine.SessionSettings;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import com.phillippitts.answercoach.service.oracle.ConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.PhrasingOracle;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;

/**
 * Builds independent sessions wired to the application's strategy and oracles.
 * Every call yields a session with its own buffer, state machine and logs.
 */
public class SessionFactory {

    private final CoverageStrategy strategy;
    private final OracleInvoker invoker;
    private final ConfidenceOracle confidenceOracle;
    private final PhrasingOracle phrasingOracle;
    private final SessionSettings settings;
    private final Clock clock;
    private final CoverageMetricsPublisher metrics;
    private final ApplicationEventPublisher publisher;

    public SessionFactory(CoverageStrategy strategy, OracleInvoker invoker, ConfidenceOracle confidenceOracle,
                          PhrasingOracle phrasingOracle, SessionSettings settings, Clock clock,
                          CoverageMetricsPublisher metrics, ApplicationEventPublisher publisher) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.confidenceOracle = Objects.requireNonNull(confidenceOracle, "confidenceOracle");
        this.phrasingOracle = Objects.requireNonNull(phrasingOracle, "phrasingOracle");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * @throws com.phillippitts.answercoach.exception.ConfigurationException if the bullets are invalid
     */
    public CoverageSession create(QuestionDefinition question) {
        return CoverageSessionBuilder.builder()
                .question(question)
                .strategy(strategy)
                .invoker(invoker)
                .confidenceOracle(confidenceOracle)
                .phrasingOracle(phrasingOracle)
                .settings(settings)
                .clock(clock)
                .metrics(metrics)
                .publisher(publisher)
                .build();
    }

    public Clock getClock() {
        return clock;
    }
}
