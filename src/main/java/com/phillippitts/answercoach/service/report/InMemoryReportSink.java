package com.phillippitts.answercoach.service.report;

import com.phillippitts.answercoach.domain.SessionReport;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps reports in memory, in append order. Default sink and test double.
 */
public final class InMemoryReportSink implements ReportSink {

    private final List<SessionReport> reports = new CopyOnWriteArrayList<>();

    @Override
    public void append(SessionReport report) {
        reports.add(Objects.requireNonNull(report, "report"));
    }

    public List<SessionReport> reports() {
        return List.copyOf(reports);
    }
}
