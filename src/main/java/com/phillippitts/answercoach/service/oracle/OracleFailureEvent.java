package com.phillippitts.answercoach.service.oracle;

import java.time.Instant;

/**
 * Published when an oracle call fell back to its degraded answer.
 *
 * <p>PII note: never carries transcript text, only technical diagnostics.
 *
 * @param oracle  oracle name, see {@link OracleNames}
 * @param reason  timeout, unavailable or unexpected
 * @param message short diagnostic
 * @param at      when the failure was observed
 */
public record OracleFailureEvent(String oracle, String reason, String message, Instant at) {

    public OracleFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
