package com.phillippitts.answercoach.exception;

import java.util.UUID;

/**
 * Thrown when no active session is registered under the requested id.
 */
public class SessionNotFoundException extends AnswerCoachException {

    private final UUID sessionId;

    public SessionNotFoundException(UUID sessionId) {
        super("No active session: " + sessionId);
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }
}
