/**
 * Domain models for coverage tracking.
 *
 * <p>Everything here is an immutable record or enum. Mutable per-bullet tracking is owned by
 * {@link com.phillippitts.answercoach.service.engine.BulletStateMachine} and leaves it only as
 * {@link com.phillippitts.answercoach.domain.BulletSnapshot}s.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.answercoach.domain.Bullet} - one checkable point of a model answer</li>
 *   <li>{@link com.phillippitts.answercoach.domain.TranscriptFragment} - one unit of incoming speech</li>
 *   <li>{@link com.phillippitts.answercoach.domain.FollowupRecord} - a follow-up that was shown</li>
 *   <li>{@link com.phillippitts.answercoach.domain.SessionReport} - the finalized summary</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.answercoach.domain;
