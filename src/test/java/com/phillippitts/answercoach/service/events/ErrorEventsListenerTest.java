package com.phillippitts.answercoach.service.events;

import com.phillippitts.answercoach.domain.SessionReport;
import com.phillippitts.answercoach.service.oracle.OracleFailureEvent;
import com.phillippitts.answercoach.service.session.event.SessionFinalizedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThat(l.shouldLog("oracle-coverage-timeout")).isTrue();
        assertThat(l.shouldLog("oracle-coverage-timeout")).isFalse();
        assertThat(l.shouldLog("report-sink")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();
        Instant now = Instant.now();
        SessionReport report = new SessionReport(UUID.randomUUID(), "q-1", "", List.of(), List.of(), 0.0,
                List.of(), List.of(), List.of(), List.of(), List.of(), now, now);

        assertThatCode(() -> {
            l.onOracleFailure(new OracleFailureEvent("coverage", "timeout", "deadline passed", null));
            l.onOracleFailure(new OracleFailureEvent("coverage", "timeout", "deadline passed", now));
            l.onSessionFinalized(new SessionFinalizedEvent(report, false));
            l.onSessionFinalized(new SessionFinalizedEvent(report, true));
        }).doesNotThrowAnyException();
    }
}
