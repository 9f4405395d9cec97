/**
 * The per-session coverage engine.
 *
 * <p>One evaluation cycle: {@link com.phillippitts.answercoach.service.engine.TranscriptBuffer}
 * decides a batch is ready, the configured coverage strategy judges every open bullet against the
 * full answer, the confidence oracle judges the drained speech,
 * {@link com.phillippitts.answercoach.service.engine.BulletStateMachine} applies the verdicts, and
 * {@link com.phillippitts.answercoach.service.engine.FollowupScheduler} picks at most one
 * follow-up.
 *
 * <p>Thread-safety: all of a session's state is touched only under its cycle lock; producers
 * enqueue through {@link com.phillippitts.answercoach.service.engine.CoverageSession#submit}.
 *
 * @since 1.0
 */
package com.phillippitts.answercoach.service.engine;
