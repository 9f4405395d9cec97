package com.phillippitts.answercoach.exception;

import java.util.UUID;

/**
 * Thrown when a caller uses a session in a way its lifecycle forbids, such as
 * finalizing it twice or feeding it fragments after it was finalized.
 */
public class SessionStateException extends AnswerCoachException {

    private final UUID sessionId;

    public SessionStateException(UUID sessionId, String message) {
        super(message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
