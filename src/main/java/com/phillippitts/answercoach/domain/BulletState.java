package com.phillippitts.answercoach.domain;

/**
 * Coverage state of a single bullet.
 *
 * <p>{@link #COVERED} and {@link #SKIPPED} are terminal: once reached, the bullet is frozen for the
 * rest of the session. {@link #PARTIAL} and {@link #INCOMPLETE} are stored directly from the
 * coverage verdict and feed follow-up priority.
 */
public enum BulletState {
    UNCOVERED,
    PENDING,
    PARTIAL,
    INCOMPLETE,
    COVERED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COVERED || this == SKIPPED;
    }

    /**
     * States a follow-up may target.
     */
    public boolean acceptsFollowup() {
        return this == UNCOVERED || this == PENDING || this == PARTIAL || this == INCOMPLETE;
    }
}
