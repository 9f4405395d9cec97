package com.phillippitts.answercoach.domain;

/**
 * Speaker certainty in their most recent utterance.
 */
public enum ConfidenceVerdict {
    KNOWS,
    UNCERTAIN,
    DOES_NOT_KNOW
}
