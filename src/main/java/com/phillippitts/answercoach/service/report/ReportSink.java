package com.phillippitts.answercoach.service.report;

import com.phillippitts.answercoach.domain.SessionReport;

/**
 * Append-only destination for finalized session reports. Never rewrites earlier entries.
 */
public interface ReportSink {

    /**
     * @param report report to persist
     * @throws com.phillippitts.answercoach.exception.AnswerCoachException if it could not be stored
     */
    void append(SessionReport report);
}
