package com.phillippitts.answercoach.service.session.event;

import com.phillippitts.answercoach.domain.FollowupRecord;

import java.util.UUID;

/**
 * Emitted when a session injects a follow-up question, for whatever shows it to the speaker.
 *
 * @param sessionId  session that issued it
 * @param questionId question being answered
 * @param followup   the follow-up
 */
public record FollowupIssuedEvent(
        UUID sessionId,
        String questionId,
        FollowupRecord followup
) {}
