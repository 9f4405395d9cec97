package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.BulletState;
import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.domain.FollowupRecord;
import com.phillippitts.answercoach.domain.QuestionDefinition;
import com.phillippitts.answercoach.domain.SessionReport;
import com.phillippitts.answercoach.domain.TranscriptEntry;
import com.phillippitts.answercoach.domain.TranscriptFragment;
import com.phillippitts.answercoach.exception.SessionStateException;
import com.phillippitts.answercoach.service.coverage.CoverageAssessment;
import com.phillippitts.answercoach.service.coverage.CoverageStrategy;
import com.phillippitts.answercoach.service.metrics.CoverageMetricsPublisher;
import com.phillippitts.answercoach.service.oracle.ConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.OracleNames;
import com.phillippitts.answercoach.service.oracle.PhrasingOracle;
import com.phillippitts.answercoach.service.session.event.FollowupIssuedEvent;
import com.phillippitts.answercoach.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Tracks coverage of one spoken answer and schedules its follow-up questions.
 *
 * <p><b>Lifecycle:</b> {@code ACTIVE -> FINALIZED}, exactly once. After
 * {@link #finalizeSession()} every mutating call fails with {@link SessionStateException}.
 *
 * <p><b>Evaluation cycle:</b> drain the buffer, assess every non-terminal bullet against the
 * reconstructed answer, classify the speaker's confidence on the drained text, apply the
 * transition rules, then let the scheduler pick at most one follow-up. The follow-up question is
 * appended to the transcript log as a {@link TranscriptEntry.Kind#FOLLOWUP} entry so later cycles
 * see it as context. A cycle in which no bullet got a usable classification changes nothing.
 *
 * <p><b>Thread Model:</b> producers call {@link #submit(TranscriptFragment)}, which only enqueues.
 * Everything else runs under one {@link ReentrantLock}: the queue is drained in arrival order,
 * cycles never overlap, and bullet state, cooldowns and logs have a single writer at a time.
 *
 * @since 1.0
 * @see CoverageSessionBuilder
 */
public final class CoverageSession {

    private static final Logger LOG = LogManager.getLogger(CoverageSession.class);

    public static final String MDC_SESSION_ID = "sessionId";

    private final UUID id;
    private final QuestionDefinition question;
    private final CoverageStrategy strategy;
    private final OracleInvoker invoker;
    private final ConfidenceOracle confidenceOracle;
    private final PhrasingOracle phrasingOracle;
    private final Clock clock;
    private final CoverageMetricsPublisher metrics;
    private final ApplicationEventPublisher publisher;

    private final TranscriptBuffer buffer;
    private final BulletStateMachine machine;
    private final FollowupScheduler scheduler;
    private final Instant createdAt;

    private final BlockingQueue<TranscriptFragment> inbound = new LinkedBlockingQueue<>();
    private final Lock cycleLock = new ReentrantLock();
    private final List<TranscriptEntry> transcript = new ArrayList<>();
    private final List<FollowupRecord> followups = new ArrayList<>();

    private volatile boolean finalized;
    private Instant completedAt;
    private long lastSequenceIndex = -1;
    private boolean anyFragment;
    /** Bullet whose follow-up still awaits a confidence reading; survives noop cycles. */
    private String outstandingFollowupId;
    /** Bullet asked about by the cycle just run; blocks an immediate repeat. */
    private String previousCycleFollowupId;
    private int cycles;

    CoverageSession(CoverageSessionBuilder b) {
        this.id = b.sessionId();
        this.question = b.question();
        this.strategy = b.strategy();
        this.invoker = b.invoker();
        this.confidenceOracle = b.confidenceOracle();
        this.phrasingOracle = b.phrasingOracle();
        this.clock = b.clock();
        this.metrics = b.metrics();
        this.publisher = b.publisher();

        SessionSettings settings = b.settings();
        this.machine = new BulletStateMachine(question.bullets());
        this.createdAt = clock.instant();
        this.buffer = new TranscriptBuffer(settings.evaluationInterval(), settings.fragmentThreshold(), createdAt);
        this.scheduler = new FollowupScheduler(settings.followupCooldown());
        LOG.info("Session {} created for question {} with {} bullet(s), strategy={}",
                id, question.questionId(), machine.size(), strategy.name());
    }

    /**
     * Producer entry point: enqueues a fragment for the next {@link #processPending()} and returns
     * immediately. Never blocks on an evaluation cycle.
     *
     * @throws SessionStateException if the session is finalized
     */
    public void submit(TranscriptFragment fragment) {
        ensureActive();
        inbound.add(fragment);
    }

    /**
     * Consumer entry point: ingests every queued fragment in arrival order, then runs a cycle if
     * one is due.
     */
    public Optional<CycleOutcome> processPending() {
        return locked(() -> {
            ensureActive();
            ingestQueued();
            return evaluateIfDueLocked();
        });
    }

    /**
     * Ingests one fragment (after anything already queued) and runs a cycle if one is due.
     *
     * @throws SessionStateException if the session is finalized
     */
    public Optional<CycleOutcome> update(TranscriptFragment fragment) {
        return locked(() -> {
            ensureActive();
            ingestQueued();
            ingest(fragment);
            return evaluateIfDueLocked();
        });
    }

    /**
     * Runs a cycle if the time trigger fired since the last fragment arrived.
     */
    public Optional<CycleOutcome> evaluateIfDue() {
        return locked(() -> {
            ensureActive();
            ingestQueued();
            return evaluateIfDueLocked();
        });
    }

    /**
     * Evaluates whatever is buffered now, regardless of triggers.
     *
     * @return the cycle run, or empty if nothing was buffered
     */
    public Optional<CycleOutcome> flush() {
        return locked(() -> {
            ensureActive();
            ingestQueued();
            if (buffer.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(runCycle(clock.instant()));
        });
    }

    /**
     * Stamps the completion time, scores the session and freezes it. Fragments still queued are
     * appended to the transcript log but not evaluated.
     *
     * @return immutable report
     * @throws SessionStateException when called a second time
     */
    public SessionReport finalizeSession() {
        return locked(() -> {
            if (finalized) {
                throw new SessionStateException(id, "Session already finalized");
            }
            int queued = inbound.size();
            if (queued > 0) {
                LOG.info("Finalizing with {} queued fragment(s), logging them without evaluation", queued);
                ingestQueued();
            }
            finalized = true;
            completedAt = clock.instant();

            List<String> covered = new ArrayList<>();
            List<String> missed = new ArrayList<>();
            List<String> skipped = new ArrayList<>();
            for (BulletSnapshot s : machine.snapshots()) {
                if (s.state() == BulletState.COVERED) {
                    covered.add(s.bullet().text());
                } else {
                    missed.add(s.bullet().text());
                    if (s.state() == BulletState.SKIPPED) {
                        skipped.add(s.bullet().text());
                    }
                }
            }
            double score = SessionReport.score(covered.size(), machine.size());
            LOG.info("Session finalized: {}/{} covered, {} skipped, score={}, {} follow-up(s)",
                    covered.size(), machine.size(), skipped.size(), String.format("%.1f", score), followups.size());
            return new SessionReport(id, question.questionId(), question.questionText(), question.tags(),
                    question.subtags(), score, covered, missed, skipped, followups, transcript, createdAt, completedAt);
        });
    }

    public SessionSnapshot snapshot() {
        return locked(() -> new SessionSnapshot(id, question.questionId(), finalized, machine.snapshots(),
                followups, transcript.size(), buffer.size() + inbound.size(), cycles,
                SessionReport.score(machine.count(BulletState.COVERED), machine.size()), createdAt));
    }

    public UUID getId() {
        return id;
    }

    public QuestionDefinition getQuestion() {
        return question;
    }

    public boolean isFinalized() {
        return finalized;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Transcript log so far, speaker and follow-up entries in arrival order.
     */
    public List<TranscriptEntry> transcript() {
        return locked(() -> List.copyOf(transcript));
    }

    public List<FollowupRecord> followups() {
        return locked(() -> List.copyOf(followups));
    }

    private Optional<CycleOutcome> evaluateIfDueLocked() {
        Instant now = clock.instant();
        if (!buffer.shouldEvaluate(now)) {
            return Optional.empty();
        }
        return Optional.of(runCycle(now));
    }

    private void ingestQueued() {
        TranscriptFragment next;
        while ((next = inbound.poll()) != null) {
            ingest(next);
        }
    }

    private void ingest(TranscriptFragment fragment) {
        long seq = fragment.sequenceIndex();
        if (anyFragment) {
            if (seq <= lastSequenceIndex) {
                LOG.warn("Fragment {} arrived after {}; processing in arrival order", seq, lastSequenceIndex);
                metrics.recordSequenceGap();
            } else if (seq > lastSequenceIndex + 1) {
                LOG.warn("Sequence gap: expected {}, got {}", lastSequenceIndex + 1, seq);
                metrics.recordSequenceGap();
            }
        }
        anyFragment = true;
        lastSequenceIndex = Math.max(lastSequenceIndex, seq);
        transcript.add(TranscriptEntry.speaker(fragment));
        buffer.ingest(fragment);
    }

    private CycleOutcome runCycle(Instant now) {
        long t0 = System.nanoTime();
        cycles++;
        String drained = buffer.drain(now);
        List<BulletSnapshot> active = machine.activeSnapshots();
        LOG.debug("Cycle {}: {} active bullet(s), text='{}'", cycles, active.size(), LogSanitizer.preview(drained));

        if (active.isEmpty()) {
            outstandingFollowupId = null;
            previousCycleFollowupId = null;
            metrics.recordCycle(CoverageMetricsPublisher.CYCLE_NONE, System.nanoTime() - t0);
            return new CycleOutcome(cycles, ConfidenceVerdict.KNOWS, machine.snapshots(), null, false);
        }

        Map<String, CoverageAssessment> assessments = strategy.assess(active, fullAnswer(), drained);
        boolean usable = assessments.values().stream().anyMatch(a -> !a.degraded());
        if (!usable) {
            LOG.warn("Cycle {}: no usable coverage classification, leaving bullet states unchanged", cycles);
            previousCycleFollowupId = null;
            metrics.recordCycle(CoverageMetricsPublisher.CYCLE_NOOP, System.nanoTime() - t0);
            return new CycleOutcome(cycles, ConfidenceVerdict.KNOWS, machine.snapshots(), null, true);
        }

        ConfidenceVerdict confidence = classifyConfidence(drained);
        for (BulletSnapshot s : active) {
            CoverageAssessment assessment = assessments.getOrDefault(s.id(), CoverageAssessment.degraded(s.id(), null));
            machine.transition(s.id(), assessment, confidence, s.id().equals(outstandingFollowupId));
        }

        FollowupRecord emitted = scheduler.selectFollowup(machine, previousCycleFollowupId, now)
                .map(candidate -> emit(candidate, now))
                .orElse(null);
        previousCycleFollowupId = emitted == null ? null : emitted.bulletId();
        outstandingFollowupId = previousCycleFollowupId;

        metrics.recordCycle(emitted == null ? CoverageMetricsPublisher.CYCLE_NONE : CoverageMetricsPublisher.CYCLE_FOLLOWUP,
                System.nanoTime() - t0);
        return new CycleOutcome(cycles, confidence, machine.snapshots(), emitted, false);
    }

    private ConfidenceVerdict classifyConfidence(String drained) {
        if (drained.isBlank()) {
            return ConfidenceVerdict.KNOWS;
        }
        return invoker.invoke(OracleNames.CONFIDENCE, () -> confidenceOracle.classify(drained))
                .orElse(ConfidenceVerdict.KNOWS);
    }

    private FollowupRecord emit(FollowupCandidate candidate, Instant now) {
        String target = candidate.target().text();
        String question = invoker.invoke(OracleNames.PHRASING,
                        () -> phrasingOracle.compose(target, candidate.uncoveredBulletTexts()))
                .filter(q -> !q.isBlank())
                .orElseGet(() -> PhrasingOracle.fallback(target));
        FollowupRecord record = new FollowupRecord(candidate.target().id(), question, now);
        followups.add(record);
        transcript.add(TranscriptEntry.followup(question, now));
        LOG.info("Follow-up for bullet {}: {}", record.bulletId(), LogSanitizer.preview(question, 120));
        publisher.publishEvent(new FollowupIssuedEvent(id, this.question.questionId(), record));
        return record;
    }

    private String fullAnswer() {
        return TranscriptEntry.renderAnswer(transcript);
    }

    private void ensureActive() {
        if (finalized) {
            throw new SessionStateException(id, "Session is finalized");
        }
    }

    private <T> T locked(Supplier<T> body) {
        cycleLock.lock();
        String previous = ThreadContext.get(MDC_SESSION_ID);
        ThreadContext.put(MDC_SESSION_ID, id.toString());
        try {
            return body.get();
        } finally {
            if (previous == null) {
                ThreadContext.remove(MDC_SESSION_ID);
            } else {
                ThreadContext.put(MDC_SESSION_ID, previous);
            }
            cycleLock.unlock();
        }
    }
}
