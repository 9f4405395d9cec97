package com.phillippitts.answercoach.domain;

/**
 * Classification of how completely a bullet has been addressed by the answer so far.
 *
 * <p>The ternary classifier answers {@code COVERED | PARTIAL | INCOMPLETE}; the binary variant
 * answers {@code COVERED | UNCOVERED}.
 */
public enum CoverageVerdict {
    COVERED,
    PARTIAL,
    INCOMPLETE,
    UNCOVERED;

    /**
     * Maps a non-covered verdict onto the bullet state it stores as.
     *
     * @return matching bullet state
     */
    public BulletState toState() {
        return switch (this) {
            case COVERED -> BulletState.COVERED;
            case PARTIAL -> BulletState.PARTIAL;
            case INCOMPLETE -> BulletState.INCOMPLETE;
            case UNCOVERED -> BulletState.UNCOVERED;
        };
    }

    /**
     * Collapses a ternary verdict to the binary {@code COVERED | UNCOVERED} scale.
     */
    public CoverageVerdict toBinary() {
        return this == COVERED ? COVERED : UNCOVERED;
    }
}
