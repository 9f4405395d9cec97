/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.answercoach.config.logging.MdcFilter} - Servlet filter
 *       that injects {@code requestId} and {@code sessionId} into MDC for every HTTP request</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code sessionId} - Coverage session the request or evaluation cycle belongs to</li>
 * </ul>
 *
 * <p>Both thread pools copy these keys to their workers, so oracle calls log with the session
 * that issued them.
 *
 * @see com.phillippitts.answercoach.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.answercoach.config.logging;
