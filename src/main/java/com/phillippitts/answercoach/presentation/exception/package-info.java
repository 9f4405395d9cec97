/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.answercoach.exception.SessionNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.answercoach.exception.SessionStateException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.answercoach.exception.ConfigurationException} and bean validation
 *       failures → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SessionStateException",
 *   "message": "Session cannot accept this request",
 *   "details": "Session already finalized (session: 6f1c...)",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.answercoach.exception
 * @since 1.0
 */
package com.phillippitts.answercoach.presentation.exception;
