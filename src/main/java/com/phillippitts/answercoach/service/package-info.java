/**
 * Service layer: the coverage engine and everything around it.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.engine} - Per-session buffer, bullet state machine, follow-up scheduler
 *       and the {@code CoverageSession} that composes them</li>
 *   <li>{@code service.coverage} - Coverage strategies (classifier, claim matching)</li>
 *   <li>{@code service.oracle} - Oracle contracts, the deadline-bound invoker, offline and Gemini
 *       adapters</li>
 *   <li>{@code service.session} - Session creation, registry, transcript pumps and finalization</li>
 *   <li>{@code service.report} - Report sinks</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.events} - Operations</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Sessions own all their state; beans hold none</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.answercoach.service;
