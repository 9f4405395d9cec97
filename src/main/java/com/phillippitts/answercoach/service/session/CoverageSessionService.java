package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.FollowupRecord;
import com.phillippitts.answercoach.domain.QuestionDefinition;
import com.phillippitts.answercoach.domain.SessionReport;
import com.phillippitts.answercoach.domain.TranscriptFragment;
import com.phillippitts.answercoach.exception.AnswerCoachException;
import com.phillippitts.answercoach.exception.ConfigurationException;
import com.phillippitts.answercoach.exception.SessionStateException;
import com.phillippitts.answercoach.service.engine.CoverageSession;
import com.phillippitts.answercoach.service.engine.CycleOutcome;
import com.phillippitts.answercoach.service.engine.SessionSnapshot;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import com.phillippitts.answercoach.service.report.ReportSink;
import com.phillippitts.answercoach.service.session.event.SessionFinalizedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Coordinates the lifecycle of coverage sessions: create, feed, query, finalize.
 *
 * <p>Fragments reach a session either synchronously through {@link #submit(UUID, long, String)} or
 * through a {@link QueueTranscriptSource} drained by a {@link TranscriptPump} on the session
 * executor ({@link #attachSource(UUID)}).
 *
 * <p>Finalizing stops the pump, evaluates whatever is still buffered (when configured), freezes
 * the session, records its score and appends the report to the {@link ReportSink}. A sink failure
 * is logged and reported in the {@link SessionFinalizedEvent}; the report is still returned.
 *
 * @since 1.0
 */
public class CoverageSessionService {

    private static final Logger LOG = LogManager.getLogger(CoverageSessionService.class);

    /** Sequential oracle rounds in the longest cycle: claims, similarity, backstop, confidence, phrasing. */
    static final int ORACLE_ROUNDS_PER_CYCLE = 5;

    private static final Duration PUMP_STOP_MARGIN = Duration.ofSeconds(1);

    private final SessionFactory factory;
    private final SessionRegistry registry;
    private final ModelAnswerDecomposer decomposer;
    private final ReportSink reportSink;
    private final CoverageMetricsPublisher metrics;
    private final ApplicationEventPublisher publisher;
    private final Executor sessionExecutor;
    private final Duration pumpPollInterval;
    private final boolean flushOnFinalize;
    private final Duration pumpStopTimeout;
    private final Map<UUID, TranscriptPump> pumps = new ConcurrentHashMap<>();

    public CoverageSessionService(SessionFactory factory, SessionRegistry registry, ModelAnswerDecomposer decomposer,
                                  ReportSink reportSink, CoverageMetricsPublisher metrics,
                                  ApplicationEventPublisher publisher, Executor sessionExecutor,
                                  Duration pumpPollInterval, boolean flushOnFinalize, Duration pumpStopTimeout) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
        this.reportSink = Objects.requireNonNull(reportSink, "reportSink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.pumpPollInterval = Objects.requireNonNull(pumpPollInterval, "pumpPollInterval");
        this.flushOnFinalize = flushOnFinalize;
        this.pumpStopTimeout = Objects.requireNonNull(pumpStopTimeout, "pumpStopTimeout");
    }

    /**
     * Starts a session for a question whose bullets are already known.
     *
     * @throws ConfigurationException if the bullets are invalid
     */
    public CoverageSession create(QuestionDefinition question) {
        CoverageSession session = factory.create(question);
        registry.register(session);
        return session;
    }

    /**
     * Starts a session after decomposing a model answer into bullets.
     *
     * @throws ConfigurationException if the model answer yields invalid bullets
     */
    public CoverageSession createFromModelAnswer(String questionId, String questionText, List<String> tags,
                                                 List<String> subtags, String modelAnswer) {
        if (questionId == null || questionId.isBlank()) {
            throw new ConfigurationException("questionId", "question id must not be blank");
        }
        return create(new QuestionDefinition(questionId, questionText, tags, subtags,
                decomposer.decompose(modelAnswer)));
    }

    /**
     * Feeds one fragment and runs a cycle if one is due.
     *
     * @return the cycle run, if any
     */
    public Optional<CycleOutcome> submit(UUID sessionId, long sequenceIndex, String text) {
        CoverageSession session = registry.get(sessionId);
        TranscriptFragment fragment = new TranscriptFragment(sequenceIndex, text == null ? "" : text,
                factory.getClock().instant());
        return session.update(fragment);
    }

    /**
     * Connects an in-process transcript source to the session and starts pumping it.
     *
     * @return the source to publish fragments into
     * @throws SessionStateException if a source is already attached or the session is finalized
     */
    public QueueTranscriptSource attachSource(UUID sessionId) {
        CoverageSession session = registry.get(sessionId);
        if (session.isFinalized()) {
            throw new SessionStateException(sessionId, "Session is finalized");
        }
        QueueTranscriptSource source = new QueueTranscriptSource(factory.getClock());
        TranscriptPump pump = new TranscriptPump(session, source, pumpPollInterval);
        if (pumps.putIfAbsent(sessionId, pump) != null) {
            throw new SessionStateException(sessionId, "A transcript source is already attached");
        }
        try {
            sessionExecutor.execute(pump);
        } catch (RejectedExecutionException e) {
            pumps.remove(sessionId, pump);
            throw new AnswerCoachException("No capacity for another transcript pump", e);
        }
        LOG.info("Transcript source attached to session {}", sessionId);
        return source;
    }

    public SessionSnapshot snapshot(UUID sessionId) {
        return registry.get(sessionId).snapshot();
    }

    public List<FollowupRecord> followups(UUID sessionId) {
        return registry.get(sessionId).followups();
    }

    /**
     * Finalizes a session and persists its report.
     *
     * @throws SessionStateException if the session was already finalized
     */
    public SessionReport finalizeSession(UUID sessionId) {
        CoverageSession session = registry.get(sessionId);
        stopPump(session);
        if (flushOnFinalize && !session.isFinalized()) {
            session.flush();
        }
        SessionReport report = session.finalizeSession();
        registry.markFinalized(sessionId);
        metrics.recordScore(report.score());

        boolean persisted = true;
        try {
            reportSink.append(report);
        } catch (RuntimeException e) {
            persisted = false;
            LOG.error("Report for session {} could not be persisted", sessionId, e);
        }
        publisher.publishEvent(new SessionFinalizedEvent(report, persisted));
        return report;
    }

    /**
     * How long finalize waits for a pump: one poll plus a cycle whose every oracle round runs to
     * the deadline.
     *
     * @param oracleDeadline per-round oracle deadline
     * @param pollInterval   pump poll interval
     */
    public static Duration pumpStopTimeout(Duration oracleDeadline, Duration pollInterval) {
        return oracleDeadline.multipliedBy(ORACLE_ROUNDS_PER_CYCLE).plus(pollInterval).plus(PUMP_STOP_MARGIN);
    }

    public int activeSessions() {
        return registry.activeCount();
    }

    /**
     * Stops the session's pump and hands over fragments it had not polled yet.
     */
    private void stopPump(CoverageSession session) {
        UUID sessionId = session.getId();
        TranscriptPump pump = pumps.remove(sessionId);
        if (pump == null) {
            return;
        }
        pump.stop();
        try {
            if (!pump.awaitTermination(pumpStopTimeout)) {
                LOG.warn("Pump for session {} did not stop within {} ms; handing over its queue anyway",
                        sessionId, pumpStopTimeout.toMillis());
            }
            if (!session.isFinalized()) {
                TranscriptFragment leftover;
                while ((leftover = pump.getSource().poll(Duration.ZERO)) != null) {
                    session.submit(leftover);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping pump for session {}", sessionId);
        }
    }
}
