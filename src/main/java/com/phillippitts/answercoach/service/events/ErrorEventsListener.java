package com.phillippitts.answercoach.service.events;

import com.phillippitts.answercoach.service.oracle.OracleFailureEvent;
import com.phillippitts.answercoach.service.session.event.SessionFinalizedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onOracleFailure(OracleFailureEvent e) {
        String key = "oracle-" + e.oracle() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Oracle '{}' keeps falling back (reason={}). Check provider settings under coverage.oracle.* "
                    + "and gemini.*", e.oracle(), e.reason());
        }
    }

    @EventListener
    void onSessionFinalized(SessionFinalizedEvent e) {
        if (!e.persisted() && shouldLog("report-sink")) {
            LOG.warn("Session reports are not being persisted. Check report.sink.* settings.");
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
