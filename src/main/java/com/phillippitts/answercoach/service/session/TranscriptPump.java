package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.TranscriptFragment;
import com.phillippitts.answercoach.exception.SessionStateException;
import com.phillippitts.answercoach.service.engine.CoverageSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Consumer loop moving fragments from a {@link TranscriptSource} into one session.
 *
 * <p>When no fragment arrives within the poll interval the session still gets a chance to run
 * its time-triggered evaluation. The loop ends when the source is exhausted, the session is
 * finalized, {@link #stop()} is called or the thread is interrupted.
 */
public final class TranscriptPump implements Runnable {

    private static final Logger LOG = LogManager.getLogger(TranscriptPump.class);

    private final CoverageSession session;
    private final TranscriptSource source;
    private final Duration pollInterval;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean stopped;

    public TranscriptPump(CoverageSession session, TranscriptSource source, Duration pollInterval) {
        this.session = Objects.requireNonNull(session, "session");
        this.source = Objects.requireNonNull(source, "source");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    @Override
    public void run() {
        LOG.debug("Pump started for session {}", session.getId());
        try {
            while (!stopped && !source.isExhausted()) {
                TranscriptFragment fragment = source.poll(pollInterval);
                if (fragment != null) {
                    session.update(fragment);
                } else if (!stopped) {
                    session.evaluateIfDue();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Pump for session {} interrupted", session.getId());
        } catch (SessionStateException e) {
            LOG.debug("Pump for session {} ended: {}", session.getId(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Pump for session {} failed", session.getId(), e);
        } finally {
            finished.countDown();
            LOG.debug("Pump stopped for session {}", session.getId());
        }
    }

    /**
     * Asks the loop to end after its current poll.
     */
    public void stop() {
        stopped = true;
    }

    /**
     * Waits for the loop to end.
     *
     * @return true if it ended within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public TranscriptSource getSource() {
        return source;
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }
}
