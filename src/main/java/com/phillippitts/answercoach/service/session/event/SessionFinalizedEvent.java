package com.phillippitts.answercoach.service.session.event;

import com.phillippitts.answercoach.domain.SessionReport;

/**
 * Emitted once a session is finalized and its report was handed to the report sink.
 *
 * @param report     the final report
 * @param persisted  false when the report sink rejected it
 */
public record SessionFinalizedEvent(
        SessionReport report,
        boolean persisted
) {}
