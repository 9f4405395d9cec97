package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.TranscriptFragment;

import java.time.Duration;

/**
 * Delivers transcript fragments for one session, ordered by sequence index.
 */
public interface TranscriptSource {

    /**
     * Waits up to {@code timeout} for the next fragment.
     *
     * @return the fragment, or null when none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    TranscriptFragment poll(Duration timeout) throws InterruptedException;

    /**
     * True once the source is closed and everything it produced has been polled.
     */
    boolean isExhausted();
}
