package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.TranscriptFragment;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process transcript source fed by a speech-to-text producer.
 *
 * <p>{@link #publish(long, String)} never blocks. After {@link #close()} further publishes are
 * rejected, and the source reports exhaustion once its queue is empty.
 */
public final class QueueTranscriptSource implements TranscriptSource, AutoCloseable {

    private final BlockingQueue<TranscriptFragment> queue = new LinkedBlockingQueue<>();
    private final Clock clock;
    private volatile boolean closed;

    public QueueTranscriptSource(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param sequenceIndex producer-assigned index
     * @param text          transcribed text
     * @throws IllegalStateException if the source is closed
     */
    public void publish(long sequenceIndex, String text) {
        if (closed) {
            throw new IllegalStateException("Transcript source is closed");
        }
        queue.add(new TranscriptFragment(sequenceIndex, text == null ? "" : text, clock.instant()));
    }

    @Override
    public TranscriptFragment poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isExhausted() {
        return closed && queue.isEmpty();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return queue.size();
    }
}
