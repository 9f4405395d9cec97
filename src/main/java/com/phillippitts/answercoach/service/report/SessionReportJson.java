package com.phillippitts.answercoach.service.report;

import com.phillippitts.answercoach.domain.FollowupRecord;
import com.phillippitts.answercoach.domain.SessionReport;
import com.phillippitts.answercoach.domain.TranscriptEntry;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * JSON form of a {@link SessionReport}: one flat object per session.
 */
public final class SessionReportJson {

    private SessionReportJson() {}

    public static JSONObject toJson(SessionReport report) {
        JSONArray followups = new JSONArray();
        for (FollowupRecord f : report.followups()) {
            followups.put(new JSONObject()
                    .put("bullet_id", f.bulletId())
                    .put("question", f.question())
                    .put("emitted_at", f.emittedAt().toString()));
        }
        JSONArray transcript = new JSONArray();
        for (TranscriptEntry e : report.transcript()) {
            JSONObject entry = new JSONObject()
                    .put("kind", e.kind().name())
                    .put("text", e.text())
                    .put("at", e.at().toString());
            if (e.kind() == TranscriptEntry.Kind.SPEAKER) {
                entry.put("sequence_index", e.sequenceIndex());
            }
            transcript.put(entry);
        }
        return new JSONObject()
                .put("session_id", report.sessionId().toString())
                .put("question_id", report.questionId())
                .put("question", report.questionText())
                .put("tags", new JSONArray(report.tags()))
                .put("subtags", new JSONArray(report.subtags()))
                .put("score", report.score())
                .put("covered_points", new JSONArray(report.coveredPoints()))
                .put("missed_points", new JSONArray(report.missedPoints()))
                .put("skipped_points", new JSONArray(report.skippedPoints()))
                .put("followups", followups)
                .put("transcript", transcript)
                .put("created_at", report.createdAt().toString())
                .put("completed_at", report.completedAt().toString())
                .put("duration_ms", report.duration().toMillis());
    }
}
