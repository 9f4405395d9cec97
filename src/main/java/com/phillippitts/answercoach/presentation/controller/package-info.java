/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints under {@code /api/sessions}:
 * <ul>
 *   <li>{@code POST /api/sessions} - start a session from bullets or a model answer</li>
 *   <li>{@code POST /api/sessions/{id}/fragments} - feed one transcript fragment</li>
 *   <li>{@code GET /api/sessions/{id}} - bullet states, follow-ups and live score</li>
 *   <li>{@code GET /api/sessions/{id}/followups} - follow-ups issued so far</li>
 *   <li>{@code POST /api/sessions/{id}/finalize} - freeze the session and return its report</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they validate request shape, delegate to
 * {@link com.phillippitts.answercoach.service.session.CoverageSessionService} and let
 * {@code GlobalExceptionHandler} translate domain exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.answercoach.presentation.controller;
