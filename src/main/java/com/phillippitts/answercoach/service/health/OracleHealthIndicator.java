package com.phillippitts.answercoach.service.health;

import com.phillippitts.answercoach.service.oracle.OracleInvoker;
import com.phillippitts.answercoach.service.oracle.OracleStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the external oracles.
 *
 * <p>An oracle counts as failing when its most recent call degraded.
 * <ul>
 *   <li>UP: no oracle failing (or none called yet)</li>
 *   <li>DEGRADED: some oracles failing; sessions run on fallbacks for those</li>
 *   <li>DOWN: every oracle called so far is failing</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class OracleHealthIndicator implements HealthIndicator {

    private final OracleInvoker invoker;

    public OracleHealthIndicator(OracleInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public Health health() {
        Map<String, OracleStatus> statuses = invoker.statuses();
        long failing = statuses.values().stream().filter(OracleStatus::isFailing).count();

        Health.Builder builder = new Health.Builder();
        if (failing == 0) {
            builder.up().withDetail("status", statuses.isEmpty() ? "No oracle calls yet" : "All oracles answering");
        } else if (failing < statuses.size()) {
            builder.status("DEGRADED").withDetail("status", "Some oracles falling back");
        } else {
            builder.down().withDetail("status", "All oracles falling back");
        }
        builder.withDetail("timeoutMs", invoker.getTimeoutMs());
        statuses.forEach((name, s) -> builder.withDetail(name, describe(s)));
        return builder.build();
    }

    private static String describe(OracleStatus s) {
        return (s.isFailing() ? "failing" : "ok") + " (successes=" + s.successes() + ", failures=" + s.failures() + ")";
    }
}
