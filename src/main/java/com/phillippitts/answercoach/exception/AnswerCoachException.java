package com.phillippitts.answercoach.exception;

/**
 * Base exception for all answerCoach application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AnswerCoachException extends RuntimeException {

    public AnswerCoachException(String message) {
        super(message);
    }

    public AnswerCoachException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnswerCoachException(Throwable cause) {
        super(cause);
    }
}
