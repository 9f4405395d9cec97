package com.phillippitts.answercoach.config.oracle;

import com.phillippitts.answercoach.exception.ConfigurationException;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import com.phillippitts.answercoach.service.oracle.ClaimOracle;
import com.phillippitts.answercoach.service.oracle.ConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.CoverageOracle;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.PhrasingOracle;
import com.phillippitts.answercoach.service.oracle.SimilarityMatcher;
import com.phillippitts.answercoach.service.oracle.gemini.GeminiClaimOracle;
import com.phillippitts.answercoach.service.oracle.gemini.GeminiClient;
import com.phillippitts.answercoach.service.oracle.gemini.GeminiConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.gemini.GeminiCoverageOracle;
import com.phillippitts.answercoach.service.oracle.gemini.GeminiEmbeddingSimilarityMatcher;
import com.phillippitts.answercoach.service.oracle.gemini.GeminiPhrasingOracle;
import com.phillippitts.answercoach.service.oracle.offline.HedgePhraseConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.offline.JaccardSimilarityMatcher;
import com.phillippitts.answercoach.service.oracle.offline.SentenceClaimOracle;
import com.phillippitts.answercoach.service.oracle.offline.TemplatePhrasingOracle;
import com.phillippitts.answercoach.service.oracle.offline.TokenOverlapCoverageOracle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the oracle implementations selected by {@code coverage.oracle.provider}.
 */
@Configuration
public class OracleConfig {

    private static final Logger LOG = LogManager.getLogger(OracleConfig.class);

    @Bean
    public OracleInvoker oracleInvoker(@Qualifier("oracleExecutor") Executor oracleExecutor, OracleProperties props,
                                       CoverageMetricsPublisher metrics, ApplicationEventPublisher publisher,
                                       Clock clock) {
        LOG.info("Oracle provider={}, timeout={} ms", props.getProvider(), props.getTimeoutMs());
        return new OracleInvoker(oracleExecutor, props.getTimeoutMs(), metrics, publisher, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "coverage.oracle", name = "provider", havingValue = "gemini")
    public GeminiClient geminiClient(GeminiProperties props) {
        if (props.getApiKey().isEmpty()) {
            throw new ConfigurationException("gemini.api-key", "required when coverage.oracle.provider=GEMINI");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getConnectTimeoutMs());
        requestFactory.setReadTimeout(props.getReadTimeoutMs());
        RestClient restClient = RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .defaultHeader("x-goog-api-key", props.getApiKey())
                .requestFactory(requestFactory)
                .build();
        return new GeminiClient(restClient, props.getModel(), props.getEmbeddingModel());
    }

    @Bean
    public CoverageOracle coverageOracle(OracleProperties props, ObjectProvider<GeminiClient> gemini) {
        return switch (props.getProvider()) {
            case OFFLINE -> new TokenOverlapCoverageOracle();
            case GEMINI -> new GeminiCoverageOracle(gemini.getObject());
        };
    }

    @Bean
    public ConfidenceOracle confidenceOracle(OracleProperties props, ObjectProvider<GeminiClient> gemini) {
        return switch (props.getProvider()) {
            case OFFLINE -> new HedgePhraseConfidenceOracle();
            case GEMINI -> new GeminiConfidenceOracle(gemini.getObject());
        };
    }

    @Bean
    public ClaimOracle claimOracle(OracleProperties props, ObjectProvider<GeminiClient> gemini) {
        return switch (props.getProvider()) {
            case OFFLINE -> new SentenceClaimOracle();
            case GEMINI -> new GeminiClaimOracle(gemini.getObject());
        };
    }

    @Bean
    public SimilarityMatcher similarityMatcher(OracleProperties props, ObjectProvider<GeminiClient> gemini) {
        return switch (props.getProvider()) {
            case OFFLINE -> new JaccardSimilarityMatcher();
            case GEMINI -> new GeminiEmbeddingSimilarityMatcher(gemini.getObject());
        };
    }

    @Bean
    public PhrasingOracle phrasingOracle(OracleProperties props, ObjectProvider<GeminiClient> gemini) {
        return switch (props.getProvider()) {
            case OFFLINE -> new TemplatePhrasingOracle();
            case GEMINI -> new GeminiPhrasingOracle(gemini.getObject());
        };
    }
}
