/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP boundary of the application. Presentation depends on the
 * service layer, never the other way round.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers and their request/response records</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.answercoach.presentation.controller
 * @see com.phillippitts.answercoach.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.answercoach.presentation;
