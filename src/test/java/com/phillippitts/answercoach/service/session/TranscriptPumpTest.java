package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.domain.TranscriptEntry;
import com.phillippitts.answercoach.service.coverage.ClassifierCoverageStrategy;
import com.phillippitts.answercoach.service.engine.CoverageSession;
import com.phillippitts.answercoach.service.engine.CoverageSessionBuilder;
import com.phillippitts.answercoach.service.engine.SessionSettings;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.testutil.EventCapturingPublisher;
import com.phillippitts.answercoach.testutil.MutableClock;
import com.phillippitts.answercoach.testutil.ScriptedConfidenceOracle;
import com.phillippitts.answercoach.testutil.ScriptedCoverageOracle;
import com.phillippitts.answercoach.testutil.TestSessions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class TranscriptPumpTest {

    private MutableClock clock;
    private CoverageSession session;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        OracleInvoker invoker = TestSessions.syncInvoker(publisher, clock);
        session = CoverageSessionBuilder.builder()
                .question(TestSessions.question("heap stores objects"))
                .strategy(new ClassifierCoverageStrategy(invoker,
                        new ScriptedCoverageOracle().answer("heap stores objects", CoverageVerdict.PARTIAL)))
                .invoker(invoker)
                .confidenceOracle(new ScriptedConfidenceOracle())
                .settings(new SessionSettings(Duration.ofSeconds(20), 3, Duration.ofSeconds(30)))
                .clock(clock)
                .build();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void pumpsFragmentsAndEndsWhenSourceExhausted() {
        QueueTranscriptSource source = new QueueTranscriptSource(clock);
        TranscriptPump pump = new TranscriptPump(session, source, Duration.ofMillis(10));
        executor.execute(pump);

        source.publish(0, "one");
        source.publish(1, "two");
        source.close();

        await().atMost(5, TimeUnit.SECONDS).until(pump::isFinished);
        assertThat(session.transcript()).extracting(TranscriptEntry::text).containsExactly("one", "two");
    }

    @Test
    void idlePumpRunsTimeTrigger() {
        QueueTranscriptSource source = new QueueTranscriptSource(clock);
        TranscriptPump pump = new TranscriptPump(session, source, Duration.ofMillis(10));
        executor.execute(pump);

        source.publish(0, "one");
        await().atMost(5, TimeUnit.SECONDS).until(() -> session.transcript().size() == 1);
        clock.advanceSeconds(21);

        await().atMost(5, TimeUnit.SECONDS).until(() -> session.snapshot().cycles() == 1);
        assertThat(session.followups()).hasSize(1);
        pump.stop();
        await().atMost(5, TimeUnit.SECONDS).until(pump::isFinished);
    }

    @Test
    void pumpEndsQuietlyWhenSessionIsFinalized() {
        QueueTranscriptSource source = new QueueTranscriptSource(clock);
        TranscriptPump pump = new TranscriptPump(session, source, Duration.ofMillis(10));
        executor.execute(pump);

        session.finalizeSession();

        await().atMost(5, TimeUnit.SECONDS).until(pump::isFinished);
        assertThat(source.isClosed()).isFalse();
    }
}
