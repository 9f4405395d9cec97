package com.phillippitts.answercoach.service.oracle.gemini;

import com.phillippitts.answercoach.domain.Claim;
import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.oracle.OracleNames;
import com.phillippitts.answercoach.service.oracle.SimilarityMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeminiOraclesTest {

    private GeminiClient client;

    @BeforeEach
    void setUp() {
        client = mock(GeminiClient.class);
    }

    @ParameterizedTest
    @CsvSource({
            "covered, COVERED",
            "complete, COVERED",
            "Partial, PARTIAL",
            "incomplete, INCOMPLETE",
            "uncovered, UNCOVERED"
    })
    void coverageStatusMapsToVerdict(String status, CoverageVerdict expected) {
        when(client.generateJson(eq(OracleNames.COVERAGE), anyString()))
                .thenReturn("{\"status\": \"" + status + "\"}");

        assertThat(new GeminiCoverageOracle(client).classify("heap stores objects", "answer"))
                .isEqualTo(expected);
    }

    @Test
    void coveragePromptCarriesBulletAndAnswer() {
        when(client.generateJson(eq(OracleNames.COVERAGE), anyString())).thenReturn("{\"status\":\"partial\"}");

        new GeminiCoverageOracle(client).classify("heap stores objects", "the heap holds things");

        verify(client).generateJson(eq(OracleNames.COVERAGE), contains("heap stores objects"));
        verify(client).generateJson(eq(OracleNames.COVERAGE), contains("the heap holds things"));
    }

    @Test
    void unknownCoverageStatusIsUnavailable() {
        when(client.generateJson(eq(OracleNames.COVERAGE), anyString())).thenReturn("{\"status\":\"maybe\"}");

        assertThatThrownBy(() -> new GeminiCoverageOracle(client).classify("b", "a"))
                .isInstanceOf(OracleUnavailableException.class)
                .hasMessageContaining("maybe");
    }

    @Test
    void confidenceStates() {
        GeminiConfidenceOracle oracle = new GeminiConfidenceOracle(client);
        when(client.generateJson(eq(OracleNames.CONFIDENCE), anyString())).thenReturn("{\"state\":\"does_not_know\"}");
        assertThat(oracle.classify("no idea")).isEqualTo(ConfidenceVerdict.DOES_NOT_KNOW);

        when(client.generateJson(eq(OracleNames.CONFIDENCE), anyString())).thenReturn("garbage");
        assertThatThrownBy(() -> oracle.classify("x")).isInstanceOf(OracleUnavailableException.class);
    }

    @Test
    void claimsFromBareArrayOrWrapper() {
        GeminiClaimOracle oracle = new GeminiClaimOracle(client);
        when(client.generateJson(eq(OracleNames.CLAIM), anyString())).thenReturn(
                "[{\"claim\":\"heap is shared\",\"entities\":[\"heap\"],\"predicate\":\"is\"},{\"claim\":\"\"}]");

        List<Claim> claims = oracle.extract("the heap is shared");
        assertThat(claims).hasSize(1);
        assertThat(claims.get(0).entities()).containsExactly("heap");
        assertThat(claims.get(0).predicate()).isEqualTo("is");

        when(client.generateJson(eq(OracleNames.CLAIM), anyString()))
                .thenReturn("{\"claims\":[{\"claim\":\"stack is per thread\"}]}");
        assertThat(oracle.extract("x")).extracting(Claim::text).containsExactly("stack is per thread");

        when(client.generateJson(eq(OracleNames.CLAIM), anyString())).thenReturn("nothing");
        assertThatThrownBy(() -> oracle.extract("x")).isInstanceOf(OracleUnavailableException.class);
    }

    @Test
    void phrasingNeedsQuestion() {
        GeminiPhrasingOracle oracle = new GeminiPhrasingOracle(client);
        when(client.generateJson(eq(OracleNames.PHRASING), anyString()))
                .thenReturn("{\"question\":\"What lives on the stack?\"}");
        assertThat(oracle.compose("stack holds frames", List.of())).isEqualTo("What lives on the stack?");

        when(client.generateJson(eq(OracleNames.PHRASING), anyString())).thenReturn("{\"question\":\"  \"}");
        assertThatThrownBy(() -> oracle.compose("stack holds frames", List.of()))
                .isInstanceOf(OracleUnavailableException.class);
    }

    @Test
    void embeddingMatcherUsesCosine() {
        when(client.embed(eq(OracleNames.SIMILARITY), anyList())).thenReturn(List.of(
                new double[]{1, 0},
                new double[]{0, 1},
                new double[]{1, 0.1}));

        List<SimilarityMatch> matches = new GeminiEmbeddingSimilarityMatcher(client)
                .bestMatch(List.of("claim"), List.of("bullet a", "bullet b"));

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).bulletIndex()).isEqualTo(1);
        assertThat(matches.get(0).score()).isCloseTo(0.995, within(0.001));
        assertThat(GeminiEmbeddingSimilarityMatcher.cosine(new double[]{1, 0}, new double[]{-1, 0}))
                .isEqualTo(-1.0);
    }
}
