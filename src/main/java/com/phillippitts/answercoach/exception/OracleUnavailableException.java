package com.phillippitts.answercoach.exception;

/**
 * Thrown by an oracle adapter when the external classifier cannot produce a usable answer:
 * network failure, timeout, HTTP error or output that does not match the declared contract.
 *
 * <p>This exception never escapes an evaluation cycle. The
 * {@link com.phillippitts.answercoach.service.oracle.OracleInvoker} converts it into the
 * conservative fallback for the affected call.
 */
public class OracleUnavailableException extends AnswerCoachException {

    private final String oracleName;

    public OracleUnavailableException(String message, String oracleName) {
        super(message + " (oracle: " + oracleName + ")");
        this.oracleName = oracleName;
    }

    public OracleUnavailableException(String message, String oracleName, Throwable cause) {
        super(message + " (oracle: " + oracleName + ")", cause);
        this.oracleName = oracleName;
    }

    public String getOracleName() {
        return oracleName;
    }
}
