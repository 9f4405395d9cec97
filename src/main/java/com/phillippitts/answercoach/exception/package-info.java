/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.answercoach.exception.AnswerCoachException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.answercoach.exception.ConfigurationException} - Invalid bullets,
 *       thresholds or intervals; fatal at session or application start</li>
 *   <li>{@link com.phillippitts.answercoach.exception.OracleUnavailableException} - An external
 *       classifier failed (network, timeout, malformed output); always recovered locally</li>
 *   <li>{@link com.phillippitts.answercoach.exception.SessionStateException} - Lifecycle misuse,
 *       e.g. finalizing a session twice</li>
 *   <li>{@link com.phillippitts.answercoach.exception.SessionNotFoundException} - Unknown session id</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support exception chaining and map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.answercoach.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.answercoach.exception;
