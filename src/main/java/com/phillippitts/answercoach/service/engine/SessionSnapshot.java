package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.FollowupRecord;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Point-in-time view of a session for status queries.
 *
 * @param sessionId         session id
 * @param questionId        question id
 * @param finalized         whether the session was finalized
 * @param bullets           bullet states, declaration order
 * @param followups         follow-ups emitted so far
 * @param transcriptEntries number of entries in the transcript log
 * @param bufferedFragments fragments waiting for the next cycle
 * @param cycles            evaluation cycles run
 * @param score             coverage score so far
 * @param createdAt         creation time
 */
public record SessionSnapshot(UUID sessionId, String questionId, boolean finalized, List<BulletSnapshot> bullets,
                              List<FollowupRecord> followups, int transcriptEntries, int bufferedFragments,
                              int cycles, double score, Instant createdAt) {

    public SessionSnapshot {
        bullets = List.copyOf(bullets);
        followups = List.copyOf(followups);
    }
}
