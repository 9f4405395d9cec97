package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.TranscriptFragment;
import com.phillippitts.answercoach.util.TimeUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Accumulates fragments between evaluation cycles and decides when a batch is ready.
 *
 * <p>A batch is ready when at least one fragment is buffered and either more than the evaluation
 * interval has passed since the last drain or the number of buffered fragments reached the
 * threshold. The first interval is measured from the buffer's creation.
 *
 * <p><b>Thread Safety:</b> not thread-safe. Owned by the session consumer, which only touches it
 * while holding the session's cycle lock.
 *
 * @since 1.0
 */
public final class TranscriptBuffer {

    private final Duration evaluationInterval;
    private final int fragmentThreshold;
    private final List<TranscriptFragment> pending = new ArrayList<>();
    private Instant lastEvaluationAt;

    /**
     * @param evaluationInterval time trigger, must be positive
     * @param fragmentThreshold  count trigger, must be at least 1
     * @param startedAt          reference point for the first time trigger
     */
    public TranscriptBuffer(Duration evaluationInterval, int fragmentThreshold, Instant startedAt) {
        this.evaluationInterval = Objects.requireNonNull(evaluationInterval, "evaluationInterval");
        if (evaluationInterval.isZero() || evaluationInterval.isNegative()) {
            throw new IllegalArgumentException("evaluationInterval must be positive");
        }
        if (fragmentThreshold < 1) {
            throw new IllegalArgumentException("fragmentThreshold must be >= 1, got: " + fragmentThreshold);
        }
        this.fragmentThreshold = fragmentThreshold;
        this.lastEvaluationAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public void ingest(TranscriptFragment fragment) {
        pending.add(Objects.requireNonNull(fragment, "fragment"));
    }

    /**
     * @param now current time
     * @return true when a drain should follow
     */
    public boolean shouldEvaluate(Instant now) {
        if (pending.isEmpty()) {
            return false;
        }
        return pending.size() >= fragmentThreshold
                || TimeUtils.exceeds(lastEvaluationAt, now, evaluationInterval);
    }

    /**
     * Returns the buffered texts joined in arrival order by single spaces and clears the buffer.
     * Draining an empty buffer returns an empty string.
     *
     * @param now time of this evaluation
     * @return batch text
     */
    public String drain(Instant now) {
        StringJoiner joiner = new StringJoiner(" ");
        for (TranscriptFragment fragment : pending) {
            String text = fragment.text().strip();
            if (!text.isEmpty()) {
                joiner.add(text);
            }
        }
        pending.clear();
        lastEvaluationAt = Objects.requireNonNull(now, "now");
        return joiner.toString();
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public Instant getLastEvaluationAt() {
        return lastEvaluationAt;
    }
}
