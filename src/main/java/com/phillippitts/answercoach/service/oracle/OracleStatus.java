package com.phillippitts.answercoach.service.oracle;

import java.time.Instant;

/**
 * Call statistics for one oracle.
 *
 * @param successes   successful calls since start
 * @param failures    degraded calls since start
 * @param lastSuccess time of the last success, null if none
 * @param lastFailure time of the last failure, null if none
 */
public record OracleStatus(long successes, long failures, Instant lastSuccess, Instant lastFailure) {

    /**
     * An oracle is failing when its most recent call failed.
     */
    public boolean isFailing() {
        if (lastFailure == null) {
            return false;
        }
        return lastSuccess == null || lastFailure.isAfter(lastSuccess);
    }
}
