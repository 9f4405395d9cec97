package com.phillippitts.answercoach.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable summary of a finalized session, handed to the report sink.
 *
 * @param sessionId     session identifier
 * @param questionId    question identifier
 * @param questionText  question text
 * @param tags          question tags
 * @param subtags       question subtags
 * @param score         {@code 100 * covered / total}, 0 when the question has no bullets
 * @param coveredPoints texts of covered bullets, declaration order
 * @param missedPoints  texts of every bullet not covered (skipped ones included), declaration order
 * @param skippedPoints texts of bullets the speaker said they did not know
 * @param followups     follow-ups in emission order
 * @param transcript    full transcript log including follow-up entries
 * @param createdAt     session creation time
 * @param completedAt   finalization time
 */
public record SessionReport(
        UUID sessionId,
        String questionId,
        String questionText,
        List<String> tags,
        List<String> subtags,
        double score,
        List<String> coveredPoints,
        List<String> missedPoints,
        List<String> skippedPoints,
        List<FollowupRecord> followups,
        List<TranscriptEntry> transcript,
        Instant createdAt,
        Instant completedAt
) {

    public SessionReport {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(questionId, "questionId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(completedAt, "completedAt");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("score must be between 0 and 100, got: " + score);
        }
        tags = List.copyOf(tags);
        subtags = List.copyOf(subtags);
        coveredPoints = List.copyOf(coveredPoints);
        missedPoints = List.copyOf(missedPoints);
        skippedPoints = List.copyOf(skippedPoints);
        followups = List.copyOf(followups);
        transcript = List.copyOf(transcript);
    }

    public Duration duration() {
        return Duration.between(createdAt, completedAt);
    }

    /**
     * Computes the coverage score.
     *
     * @param covered number of covered bullets
     * @param total   number of bullets
     * @return percentage in [0,100], 0 when {@code total} is 0
     */
    public static double score(int covered, int total) {
        if (total <= 0) {
            return 0.0;
        }
        return covered * 100.0 / total;
    }
}
