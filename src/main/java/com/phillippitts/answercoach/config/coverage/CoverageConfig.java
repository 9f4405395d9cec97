package com.phillippitts.answercoach.config.coverage;

import com.phillippitts.answercoach.config.oracle.OracleProperties;
import com.phillippitts.answercoach.service.coverage.ClaimMatchingCoverageStrategy;
import com.phillippitts.answercoach.service.coverage.ClassifierCoverageStrategy;
import com.phillippitts.answercoach.service.coverage.CoverageStrategy;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import com.phillippitts.answercoach.service.oracle.ClaimOracle;
import com.phillippitts.answercoach.service.oracle.ConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.CoverageOracle;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.PhrasingOracle;
import com.phillippitts.answercoach.service.oracle.SimilarityMatcher;
import com.phillippitts.answercoach.service.report.ReportSink;
import com.phillippitts.answercoach.service.session.CoverageSessionService;
import com.phillippitts.answercoach.service.session.ModelAnswerDecomposer;
import com.phillippitts.answercoach.service.session.SessionFactory;
import com.phillippitts.answercoach.service.session.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the coverage strategy and the session layer.
 */
@Configuration
public class CoverageConfig {

    private static final Logger LOG = LogManager.getLogger(CoverageConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CoverageStrategy coverageStrategy(CoverageProperties props, OracleInvoker invoker,
                                             CoverageOracle coverageOracle, ClaimOracle claimOracle,
                                             SimilarityMatcher similarityMatcher) {
        CoverageStrategy strategy = switch (props.getStrategy()) {
            case CLASSIFIER -> new ClassifierCoverageStrategy(invoker, coverageOracle);
            case CLAIM_MATCHING -> new ClaimMatchingCoverageStrategy(invoker, claimOracle, similarityMatcher,
                    props.isBinaryBackstop() ? coverageOracle : null, props.getPresentThreshold());
        };
        LOG.info("Coverage strategy={}, interval={} ms, threshold={} fragment(s), cooldown={} ms",
                strategy.name(), props.getEvaluationIntervalMs(), props.getFragmentThreshold(),
                props.getFollowupCooldownMs());
        return strategy;
    }

    @Bean
    public SessionFactory sessionFactory(CoverageProperties props, CoverageStrategy strategy, OracleInvoker invoker,
                                         ConfidenceOracle confidenceOracle, PhrasingOracle phrasingOracle,
                                         Clock clock, CoverageMetricsPublisher metrics,
                                         ApplicationEventPublisher publisher) {
        return new SessionFactory(strategy, invoker, confidenceOracle, phrasingOracle, props.toSessionSettings(),
                clock, metrics, publisher);
    }

    @Bean
    public SessionRegistry sessionRegistry(CoverageProperties props) {
        return new SessionRegistry(props.getRetainFinalized());
    }

    @Bean
    public CoverageSessionService coverageSessionService(CoverageProperties props, SessionFactory factory,
                                                         SessionRegistry registry, ModelAnswerDecomposer decomposer,
                                                         ReportSink reportSink, CoverageMetricsPublisher metrics,
                                                         ApplicationEventPublisher publisher,
                                                         OracleProperties oracleProps,
                                                         @Qualifier("sessionExecutor") Executor sessionExecutor) {
        Duration poll = Duration.ofMillis(props.getPumpPollMs());
        return new CoverageSessionService(factory, registry, decomposer, reportSink, metrics, publisher,
                sessionExecutor, poll, props.isFlushOnFinalize(),
                CoverageSessionService.pumpStopTimeout(Duration.ofMillis(oracleProps.getTimeoutMs()), poll));
    }
}
