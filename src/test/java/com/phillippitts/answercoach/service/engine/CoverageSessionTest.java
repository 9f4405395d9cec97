package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.BulletState;
import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.domain.FollowupRecord;
import com.phillippitts.answercoach.domain.QuestionDefinition;
import com.phillippitts.answercoach.domain.SessionReport;
import com.phillippitts.answercoach.domain.TranscriptEntry;
import com.phillippitts.answercoach.domain.TranscriptFragment;
import com.phillippitts.answercoach.exception.SessionStateException;
import com.phillippitts.answercoach.service.coverage.ClassifierCoverageStrategy;
import com.phillippitts.answercoach.service.metrics.CoverageMetrics;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import com.phillippitts.answercoach.service.oracle.OracleFailureEvent;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.PhrasingOracle;
import com.phillippitts.answercoach.service.session.event.FollowupIssuedEvent;
import com.phillippitts.answercoach.testutil.EventCapturingPublisher;
import com.phillippitts.answercoach.testutil.MutableClock;
import com.phillippitts.answercoach.testutil.ScriptedConfidenceOracle;
import com.phillippitts.answercoach.testutil.ScriptedCoverageOracle;
import com.phillippitts.answercoach.testutil.TestSessions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoverageSessionTest {

    private static final String HEAP = "heap stores objects";
    private static final String STACK = "stack holds frames";
    private static final String GC = "garbage collector reclaims memory";

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private ScriptedCoverageOracle coverage;
    private ScriptedConfidenceOracle confidence;
    private OracleInvoker invoker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        publisher = new EventCapturingPublisher();
        coverage = new ScriptedCoverageOracle();
        confidence = new ScriptedConfidenceOracle();
        invoker = TestSessions.syncInvoker(publisher, clock);
    }

    private CoverageSession session(QuestionDefinition question, SessionSettings settings,
                                    CoverageMetricsPublisher metrics) {
        return CoverageSessionBuilder.builder()
                .question(question)
                .strategy(new ClassifierCoverageStrategy(invoker, coverage))
                .invoker(invoker)
                .confidenceOracle(confidence)
                .settings(settings)
                .clock(clock)
                .metrics(metrics)
                .publisher(publisher)
                .build();
    }

    /** Every fragment triggers a cycle; 30 s cooldown. */
    private CoverageSession eagerSession(String... bullets) {
        return session(TestSessions.question(bullets),
                new SessionSettings(Duration.ofSeconds(20), 1, Duration.ofSeconds(30)),
                CoverageMetricsPublisher.NOOP);
    }

    private Optional<CycleOutcome> say(CoverageSession s, long seq, String text) {
        return s.update(new TranscriptFragment(seq, text, clock.instant()));
    }

    private static BulletState stateOf(CoverageSession s, String bulletId) {
        return s.snapshot().bullets().stream()
                .filter(b -> b.id().equals(bulletId))
                .findFirst()
                .orElseThrow()
                .state();
    }

    @Test
    void partialBulletIsAskedAboutFirst() {
        CoverageSession s = eagerSession(HEAP, STACK, GC);
        coverage.answer(STACK, CoverageVerdict.PARTIAL);

        CycleOutcome outcome = say(s, 0, "the stack is per thread").orElseThrow();

        assertThat(outcome.followupRecord()).map(FollowupRecord::bulletId).contains("b2");
        assertThat(stateOf(s, "b2")).isEqualTo(BulletState.PENDING);
        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.INCOMPLETE);
        assertThat(stateOf(s, "b3")).isEqualTo(BulletState.INCOMPLETE);
    }

    @Test
    void doesNotKnowAfterFollowupSkipsBulletForGood() {
        CoverageSession s = eagerSession(HEAP, STACK, GC);
        assertThat(say(s, 0, "memory is managed").orElseThrow().followupRecord())
                .map(FollowupRecord::bulletId).contains("b1");

        clock.advanceSeconds(5);
        confidence.set(ConfidenceVerdict.DOES_NOT_KNOW);
        CycleOutcome second = say(s, 1, "i don't know").orElseThrow();

        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.SKIPPED);
        assertThat(second.followupRecord()).map(FollowupRecord::bulletId).contains("b2");

        confidence.set(ConfidenceVerdict.KNOWS);
        List<String> targets = new ArrayList<>();
        for (int i = 2; i < 8; i++) {
            clock.advanceSeconds(60);
            say(s, i, "more words").flatMap(CycleOutcome::followupRecord).ifPresent(f -> targets.add(f.bulletId()));
        }
        assertThat(targets).isNotEmpty().doesNotContain("b1");
        assertThat(s.snapshot().bullets()).filteredOn(b -> b.id().equals("b1"))
                .extracting(BulletSnapshot::state).containsExactly(BulletState.SKIPPED);
    }

    @Test
    void coverageWinsOverConfidence() {
        CoverageSession s = eagerSession(HEAP, STACK);
        say(s, 0, "hmm");
        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.PENDING);

        clock.advanceSeconds(5);
        coverage.answer(HEAP, CoverageVerdict.COVERED);
        confidence.set(ConfidenceVerdict.DOES_NOT_KNOW);
        say(s, 1, "objects are on the heap but i don't know more");

        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.COVERED);
    }

    @Test
    void emptyBulletSetFinalizesWithZeroScore() {
        CoverageSession s = eagerSession();
        say(s, 0, "anything at all");

        SessionReport report = s.finalizeSession();

        assertThat(report.score()).isZero();
        assertThat(report.coveredPoints()).isEmpty();
        assertThat(report.missedPoints()).isEmpty();
        assertThat(report.followups()).isEmpty();
    }

    @Test
    void terminalBulletsAreFrozen() {
        CoverageSession s = eagerSession(HEAP);
        coverage.answer(HEAP, CoverageVerdict.COVERED);
        say(s, 0, "objects live on the heap");
        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.COVERED);

        coverage.answer(HEAP, CoverageVerdict.UNCOVERED);
        clock.advanceSeconds(60);
        say(s, 1, "actually no");

        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.COVERED);
    }

    @Test
    void sameBulletIsNeverAskedTwiceInARow() {
        CoverageSession s = session(TestSessions.question(HEAP),
                new SessionSettings(Duration.ofSeconds(20), 1, Duration.ofSeconds(1)), CoverageMetricsPublisher.NOOP);

        assertThat(say(s, 0, "a").orElseThrow().followupRecord()).isPresent();
        clock.advanceSeconds(2);
        assertThat(say(s, 1, "b").orElseThrow().followupRecord()).isEmpty();
        clock.advanceSeconds(2);
        assertThat(say(s, 2, "c").orElseThrow().followupRecord()).map(FollowupRecord::bulletId).contains("b1");
    }

    @Test
    void cooldownBlocksEarlyRepeat() {
        CoverageSession s = eagerSession(HEAP, STACK);
        coverage.answer(STACK, CoverageVerdict.COVERED);

        assertThat(say(s, 0, "stack frames").orElseThrow().followupRecord())
                .map(FollowupRecord::bulletId).contains("b1");
        clock.advanceSeconds(5);
        assertThat(say(s, 1, "x").orElseThrow().followupRecord()).isEmpty();
        clock.advanceSeconds(10);
        assertThat(say(s, 2, "y").orElseThrow().followupRecord()).isEmpty();
        clock.advanceSeconds(30);
        assertThat(say(s, 3, "z").orElseThrow().followupRecord()).map(FollowupRecord::bulletId).contains("b1");
    }

    @Test
    void knowsRestoresPriorClassificationInsteadOfUncovered() {
        CoverageSession s = eagerSession(HEAP, STACK);
        coverage.answer(HEAP, CoverageVerdict.PARTIAL);
        say(s, 0, "objects");
        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.PENDING);

        clock.advanceSeconds(5);
        confidence.set(ConfidenceVerdict.KNOWS);
        say(s, 1, "objects are allocated");

        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.PARTIAL);
    }

    @Test
    void uncertainKeepsBulletPending() {
        CoverageSession s = eagerSession(HEAP, STACK);
        say(s, 0, "objects");

        clock.advanceSeconds(5);
        confidence.set(ConfidenceVerdict.UNCERTAIN);
        say(s, 1, "maybe the heap");

        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.PENDING);
    }

    @Test
    void cycleWithoutUsableClassificationChangesNothing() {
        CoverageSession s = eagerSession(HEAP, STACK, GC);
        coverage.failAll(true);

        CycleOutcome outcome = say(s, 0, "words").orElseThrow();

        assertThat(outcome.noop()).isTrue();
        assertThat(outcome.followupRecord()).isEmpty();
        assertThat(s.snapshot().bullets()).extracting(BulletSnapshot::state).containsOnly(BulletState.UNCOVERED);
        assertThat(publisher.eventsOf(OracleFailureEvent.class)).hasSize(3);
        assertThat(confidence.texts()).isEmpty();
    }

    @Test
    void noopCycleKeepsOutstandingFollowup() {
        CoverageSession s = eagerSession(HEAP, STACK);
        say(s, 0, "start");

        clock.advanceSeconds(5);
        coverage.failAll(true);
        assertThat(say(s, 1, "noise").orElseThrow().noop()).isTrue();

        clock.advanceSeconds(5);
        coverage.failAll(false);
        confidence.set(ConfidenceVerdict.DOES_NOT_KNOW);
        say(s, 2, "no idea");

        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.SKIPPED);
    }

    @Test
    void noopCycleDoesNotCountAsImmediateRepeat() {
        CoverageSession s = eagerSession(HEAP);
        assertThat(say(s, 0, "start").orElseThrow().followupRecord())
                .map(FollowupRecord::bulletId).contains("b1");

        clock.advanceSeconds(10);
        coverage.failAll(true);
        assertThat(say(s, 1, "noise").orElseThrow().noop()).isTrue();

        clock.advanceSeconds(21);
        coverage.failAll(false);
        assertThat(say(s, 2, "still thinking").orElseThrow().followupRecord())
                .map(FollowupRecord::bulletId).contains("b1");
    }

    @Test
    void singleFailedBulletKeepsItsState() {
        CoverageSession s = eagerSession(HEAP, STACK);
        coverage.answer(STACK, CoverageVerdict.PARTIAL);
        coverage.fail(HEAP);

        CycleOutcome outcome = say(s, 0, "frames").orElseThrow();

        assertThat(outcome.noop()).isFalse();
        assertThat(stateOf(s, "b1")).isEqualTo(BulletState.UNCOVERED);
        assertThat(outcome.followupRecord()).map(FollowupRecord::bulletId).contains("b2");
    }

    @Test
    void followupIsLoggedAndFedBackAsContext() {
        CoverageSession s = eagerSession(HEAP);
        say(s, 0, "memory");

        List<TranscriptEntry> transcript = s.transcript();
        assertThat(transcript).extracting(TranscriptEntry::kind)
                .containsExactly(TranscriptEntry.Kind.SPEAKER, TranscriptEntry.Kind.FOLLOWUP);
        assertThat(transcript.get(1).text()).isEqualTo(PhrasingOracle.fallback(HEAP));
        assertThat(publisher.eventsOf(FollowupIssuedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.followup().bulletId()).isEqualTo("b1"));

        clock.advanceSeconds(5);
        say(s, 1, "objects");
        assertThat(coverage.answersSeen().get(coverage.answersSeen().size() - 1))
                .startsWith("memory\n" + TranscriptEntry.FOLLOWUP_MARKER)
                .endsWith("\nobjects");
    }

    @Test
    void phrasingFailureFallsBackToTemplate() {
        CoverageSession s = CoverageSessionBuilder.builder()
                .question(TestSessions.question(HEAP))
                .strategy(new ClassifierCoverageStrategy(invoker, coverage))
                .invoker(invoker)
                .confidenceOracle(confidence)
                .phrasingOracle((target, uncovered) -> {
                    throw new IllegalStateException("boom");
                })
                .settings(new SessionSettings(Duration.ofSeconds(20), 1, Duration.ofSeconds(30)))
                .clock(clock)
                .build();

        FollowupRecord record = say(s, 0, "x").flatMap(CycleOutcome::followupRecord).orElseThrow();

        assertThat(record.question()).isEqualTo(PhrasingOracle.fallback(HEAP));
    }

    @Test
    void countTriggerJoinsBufferedFragments() {
        CoverageSession s = session(TestSessions.question(HEAP),
                new SessionSettings(Duration.ofSeconds(20), 3, Duration.ofSeconds(30)), CoverageMetricsPublisher.NOOP);

        assertThat(say(s, 0, " one ")).isEmpty();
        assertThat(say(s, 1, "two")).isEmpty();
        assertThat(say(s, 2, "three")).isPresent();

        assertThat(confidence.texts()).containsExactly("one two three");
    }

    @Test
    void timeTriggerFiresOnlyAfterIntervalElapsed() {
        CoverageSession s = session(TestSessions.question(HEAP),
                new SessionSettings(Duration.ofSeconds(20), 3, Duration.ofSeconds(30)), CoverageMetricsPublisher.NOOP);
        say(s, 0, "one");

        assertThat(s.evaluateIfDue()).isEmpty();
        clock.advanceSeconds(20);
        assertThat(s.evaluateIfDue()).isEmpty();
        clock.advanceSeconds(1);
        assertThat(s.evaluateIfDue()).isPresent();
        assertThat(s.evaluateIfDue()).isEmpty();
    }

    @Test
    void submitOnlyQueuesUntilProcessed() {
        CoverageSession s = eagerSession(HEAP);
        s.submit(new TranscriptFragment(0, "queued", clock.instant()));

        assertThat(s.transcript()).isEmpty();
        assertThat(s.processPending()).isPresent();
        assertThat(s.transcript()).extracting(TranscriptEntry::text).first().isEqualTo("queued");
    }

    @Test
    void flushEvaluatesBufferedSpeech() {
        CoverageSession s = session(TestSessions.question(HEAP),
                new SessionSettings(Duration.ofSeconds(20), 5, Duration.ofSeconds(30)), CoverageMetricsPublisher.NOOP);
        assertThat(s.flush()).isEmpty();
        say(s, 0, "heap objects");

        assertThat(s.flush()).isPresent();
        assertThat(s.snapshot().bufferedFragments()).isZero();
    }

    @Test
    void finalizeReportsScoreAndMissedIncludingSkipped() {
        CoverageSession s = eagerSession(HEAP, STACK, GC, "metaspace holds class metadata");
        coverage.answer(STACK, CoverageVerdict.COVERED);
        say(s, 0, "stack frames");
        clock.advanceSeconds(5);
        confidence.set(ConfidenceVerdict.DOES_NOT_KNOW);
        say(s, 1, "no clue");
        clock.advanceSeconds(7);

        SessionReport report = s.finalizeSession();

        assertThat(report.score()).isEqualTo(25.0);
        assertThat(report.coveredPoints()).containsExactly(STACK);
        assertThat(report.skippedPoints()).containsExactly(HEAP);
        assertThat(report.missedPoints()).containsExactly(HEAP, GC, "metaspace holds class metadata");
        assertThat(report.duration()).isEqualTo(Duration.ofSeconds(12));
        assertThat(report.questionId()).isEqualTo("q-1");
        assertThat(report.tags()).containsExactly("java");
    }

    @Test
    void finalizeLogsQueuedFragmentsWithoutEvaluating() {
        CoverageSession s = eagerSession(HEAP);
        s.submit(new TranscriptFragment(0, "the heap stores objects", clock.instant()));

        SessionReport report = s.finalizeSession();

        assertThat(report.transcript()).extracting(TranscriptEntry::text)
                .containsExactly("the heap stores objects");
        assertThat(report.score()).isZero();
        assertThat(coverage.answersSeen()).isEmpty();
    }

    @Test
    void finalizedSessionRejectsEverything() {
        CoverageSession s = eagerSession(HEAP);
        s.finalizeSession();

        assertThat(s.isFinalized()).isTrue();
        assertThatThrownBy(s::finalizeSession).isInstanceOf(SessionStateException.class);
        assertThatThrownBy(() -> say(s, 0, "late")).isInstanceOf(SessionStateException.class);
        assertThatThrownBy(() -> s.submit(new TranscriptFragment(1, "late", clock.instant())))
                .isInstanceOf(SessionStateException.class);
        assertThat(s.snapshot().finalized()).isTrue();
    }

    @Test
    void outOfOrderAndGappedFragmentsAreProcessedAndCounted() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CoverageSession s = session(TestSessions.question(HEAP),
                new SessionSettings(Duration.ofSeconds(20), 10, Duration.ofSeconds(30)),
                new CoverageMetricsPublisher(new CoverageMetrics(registry)));

        say(s, 0, "a");
        say(s, 2, "c");
        say(s, 1, "b");

        assertThat(s.transcript()).extracting(TranscriptEntry::text).containsExactly("a", "c", "b");
        assertThat(registry.get("answercoach.transcript.sequence_gap").counter().count()).isEqualTo(2.0);
    }

    @Test
    void concurrentProducersLoseNoFragments() throws Exception {
        CoverageSession s = session(TestSessions.question(HEAP, STACK),
                new SessionSettings(Duration.ofSeconds(20), 3, Duration.ofSeconds(30)), CoverageMetricsPublisher.NOOP);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                final int base = t * 25;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        say(s, base + i, "word" + (base + i));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(s.transcript()).filteredOn(e -> e.kind() == TranscriptEntry.Kind.SPEAKER).hasSize(100);
        assertThat(s.snapshot().cycles()).isGreaterThan(0);
    }
}
