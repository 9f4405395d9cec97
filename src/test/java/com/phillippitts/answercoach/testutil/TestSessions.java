package com.phillippitts.answercoach.testutil;

import com.phillippitts.answercoach.domain.Bullet;
import com.phillippitts.answercoach.domain.QuestionDefinition;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared fixtures for session-level tests.
 */
public final class TestSessions {

    private TestSessions() {
    }

    /**
     * Invoker running oracle calls on the calling thread.
     */
    public static OracleInvoker syncInvoker(EventCapturingPublisher publisher, Clock clock) {
        return new OracleInvoker(new SyncExecutor(), 1_000, CoverageMetricsPublisher.NOOP, publisher, clock);
    }

    /**
     * Question with bullets {@code b1..bn} whose texts are the given strings.
     */
    public static QuestionDefinition question(String... bulletTexts) {
        List<Bullet> bullets = new ArrayList<>();
        for (int i = 0; i < bulletTexts.length; i++) {
            bullets.add(new Bullet("b" + (i + 1), bulletTexts[i]));
        }
        return new QuestionDefinition("q-1", "Explain the JVM memory model", List.of("java"), List.of("jvm"),
                bullets);
    }
}
