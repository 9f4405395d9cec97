package com.phillippitts.answercoach.presentation.controller;

import com.phillippitts.answercoach.domain.BulletSnapshot;
import com.phillippitts.answercoach.domain.FollowupRecord;
import com.phillippitts.answercoach.domain.SessionReport;
import com.phillippitts.answercoach.domain.TranscriptEntry;
import com.phillippitts.answercoach.service.engine.CycleOutcome;
import com.phillippitts.answercoach.service.engine.SessionSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Request and response bodies of the session API.
 */
final class SessionDtos {

    private SessionDtos() {
    }

    /**
     * Either {@code bullets} or {@code modelAnswer} describes what a complete answer contains.
     */
    record CreateSessionRequest(
            @NotBlank String questionId,
            String questionText,
            List<String> tags,
            List<String> subtags,
            @Valid List<BulletRequest> bullets,
            String modelAnswer
    ) {
    }

    record BulletRequest(@NotBlank String id, @NotBlank String text) {
    }

    record FragmentRequest(@NotNull @PositiveOrZero Long sequenceIndex, @NotNull String text) {
    }

    record FollowupResponse(String bulletId, String question, Instant emittedAt) {
        static FollowupResponse from(FollowupRecord r) {
            return new FollowupResponse(r.bulletId(), r.question(), r.emittedAt());
        }

        static List<FollowupResponse> fromAll(List<FollowupRecord> records) {
            return records.stream().map(FollowupResponse::from).toList();
        }
    }

    record BulletResponse(String id, String text, String state, String lastVerdict, Instant lastFollowupAt,
                          Double bestMatchScore) {
        static BulletResponse from(BulletSnapshot s) {
            return new BulletResponse(s.id(), s.bullet().text(), s.state().name(), s.lastVerdict().name(),
                    s.lastFollowupAt(), s.bestMatchScore());
        }
    }

    record SessionResponse(UUID sessionId, String questionId, String status, double score, int cycles,
                           int bufferedFragments, List<BulletResponse> bullets, List<FollowupResponse> followups,
                           Instant createdAt) {
        static SessionResponse from(SessionSnapshot s) {
            return new SessionResponse(s.sessionId(), s.questionId(), s.finalized() ? "FINALIZED" : "ACTIVE",
                    s.score(), s.cycles(), s.bufferedFragments(),
                    s.bullets().stream().map(BulletResponse::from).toList(),
                    FollowupResponse.fromAll(s.followups()), s.createdAt());
        }
    }

    /**
     * Result of feeding one fragment. {@code cycle} is 0 when no evaluation ran.
     */
    record FragmentResponse(boolean evaluated, int cycle, String confidence, boolean noop,
                            FollowupResponse followup) {
        static FragmentResponse from(CycleOutcome outcome) {
            if (outcome == null) {
                return new FragmentResponse(false, 0, null, false, null);
            }
            return new FragmentResponse(true, outcome.cycle(), outcome.confidence().name(), outcome.noop(),
                    outcome.followupRecord().map(FollowupResponse::from).orElse(null));
        }
    }

    record TranscriptEntryResponse(String kind, String text, long sequenceIndex, Instant at) {
        static TranscriptEntryResponse from(TranscriptEntry e) {
            return new TranscriptEntryResponse(e.kind().name(), e.text(), e.sequenceIndex(), e.at());
        }
    }

    record ReportResponse(UUID sessionId, String questionId, String questionText, List<String> tags,
                          List<String> subtags, double score, List<String> coveredPoints,
                          List<String> missedPoints, List<String> skippedPoints,
                          List<FollowupResponse> followups, List<TranscriptEntryResponse> transcript,
                          Instant createdAt, Instant completedAt, long durationMs) {
        static ReportResponse from(SessionReport r) {
            return new ReportResponse(r.sessionId(), r.questionId(), r.questionText(), r.tags(), r.subtags(),
                    r.score(), r.coveredPoints(), r.missedPoints(), r.skippedPoints(),
                    FollowupResponse.fromAll(r.followups()),
                    r.transcript().stream().map(TranscriptEntryResponse::from).toList(),
                    r.createdAt(), r.completedAt(), r.duration().toMillis());
        }
    }
}
