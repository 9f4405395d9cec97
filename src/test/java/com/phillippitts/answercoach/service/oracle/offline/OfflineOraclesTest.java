package com.phillippitts.answercoach.service.oracle.offline;

import com.phillippitts.answercoach.domain.Claim;
import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.domain.TranscriptEntry;
import com.phillippitts.answercoach.domain.TranscriptFragment;
import com.phillippitts.answercoach.service.oracle.CoverageOracle;
import com.phillippitts.answercoach.service.oracle.PhrasingOracle;
import com.phillippitts.answercoach.service.oracle.SimilarityMatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OfflineOraclesTest {

    private final TokenOverlapCoverageOracle coverage = new TokenOverlapCoverageOracle();
    private final HedgePhraseConfidenceOracle confidence = new HedgePhraseConfidenceOracle();

    @Test
    void coverageGradesByShareOfBulletTokens() {
        String bullet = "garbage collector reclaims unreachable objects";

        assertThat(coverage.classify(bullet, "The garbage collector reclaims unreachable objects automatically"))
                .isEqualTo(CoverageVerdict.COVERED);
        assertThat(coverage.classify(bullet, "objects get collected by the garbage collector"))
                .isEqualTo(CoverageVerdict.PARTIAL);
        assertThat(coverage.classify(bullet, "threads share the heap"))
                .isEqualTo(CoverageVerdict.INCOMPLETE);
    }

    @Test
    void followupQuestionsDoNotCountAsSpeech() {
        String bullet = "stack holds frames";
        String answer = "the heap\n"
                + TranscriptEntry.FOLLOWUP_MARKER + " " + PhrasingOracle.fallback(bullet) + "\n"
                + "not sure";

        assertThat(coverage.classify(bullet, answer)).isEqualTo(CoverageVerdict.INCOMPLETE);
        assertThat(TokenOverlapCoverageOracle.speakerText(answer)).isEqualTo("the heap not sure");
    }

    @Test
    void questionMarkInsideQuotedBulletDoesNotLeakIntoSpeech() {
        String bullet = "Why use a heap? It stores objects";
        String answer = TranscriptEntry.renderAnswer(List.of(
                TranscriptEntry.followup(PhrasingOracle.fallback(bullet), Instant.EPOCH),
                TranscriptEntry.speaker(new TranscriptFragment(0, "um", Instant.EPOCH))));

        assertThat(coverage.classify(bullet, answer)).isEqualTo(CoverageVerdict.INCOMPLETE);
    }

    @Test
    void followupWithoutQuestionMarkIsStillIgnored() {
        String bullet = "stack holds frames";
        String answer = TranscriptEntry.renderAnswer(List.of(
                TranscriptEntry.followup("Tell me more about how the stack holds frames", Instant.EPOCH),
                TranscriptEntry.speaker(new TranscriptFragment(0, "ok", Instant.EPOCH))));

        assertThat(coverage.classify(bullet, answer)).isEqualTo(CoverageVerdict.INCOMPLETE);
    }

    @Test
    void binaryWrapperCollapsesToCoveredOrUncovered() {
        CoverageOracle binary = CoverageOracle.binary(coverage);

        assertThat(binary.classify("stack holds frames", "stack")).isEqualTo(CoverageVerdict.UNCOVERED);
        assertThat(binary.classify("stack holds frames", "stack holds frames")).isEqualTo(CoverageVerdict.COVERED);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "I don't know what that is|DOES_NOT_KNOW",
            "I don’t know|DOES_NOT_KNOW",
            "honestly no idea|DOES_NOT_KNOW",
            "I think it is the heap|UNCERTAIN",
            "maybe the stack|UNCERTAIN",
            "The heap stores objects|KNOWS",
            "\"\"|KNOWS"
    })
    void confidenceFromHedgePhrases(String text, ConfidenceVerdict expected) {
        assertThat(confidence.classify(text)).isEqualTo(expected);
    }

    @Test
    void sentenceClaimsHaveNoMatchYet() {
        List<Claim> claims = new SentenceClaimOracle().extract("Heap is shared. Stacks are per thread.");

        assertThat(claims).extracting(Claim::text).containsExactly("Heap is shared", "Stacks are per thread");
        assertThat(claims).allSatisfy(c -> assertThat(c.matchedBulletId()).isNull());
    }

    @Test
    void jaccardPicksBestBulletAndEarlierOnTies() {
        JaccardSimilarityMatcher matcher = new JaccardSimilarityMatcher();

        List<SimilarityMatch> matches = matcher.bestMatch(
                List.of("stack holds frames", "unrelated"),
                List.of("heap stores objects", "stack holds frames"));

        assertThat(matches.get(0)).isEqualTo(new SimilarityMatch(1, 1.0));
        assertThat(matches.get(1)).isEqualTo(new SimilarityMatch(0, 0.0));
        assertThat(JaccardSimilarityMatcher.jaccard(Set.of("a", "b"), Set.of("b", "c"))).isEqualTo(1.0 / 3.0);
        assertThatThrownBy(() -> matcher.bestMatch(List.of("x"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void templatePhrasingQuotesTheBullet() {
        assertThat(new TemplatePhrasingOracle().compose("stack holds frames", List.of("stack holds frames")))
                .isEqualTo(PhrasingOracle.fallback("stack holds frames"))
                .contains("'stack holds frames'");
    }
}
