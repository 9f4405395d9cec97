package com.phillippitts.answercoach.config.oracle;

import com.phillippitts.answercoach.exception.ConfigurationException;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "coverage.oracle")
public class OracleProperties {

    public enum Provider { OFFLINE, GEMINI }

    /** Which oracle implementations to wire. */
    @NotNull
    private final Provider provider;

    /** Deadline for one oracle call (or one parallel batch), in ms. */
    private final long timeoutMs;

    @ConstructorBinding
    public OracleProperties(Provider provider, Long timeoutMs) {
        this.provider = provider == null ? Provider.OFFLINE : provider;
        this.timeoutMs = timeoutMs == null ? 8_000 : timeoutMs;
        if (this.timeoutMs <= 0) {
            throw new ConfigurationException("coverage.oracle.timeout-ms", "must be > 0");
        }
    }

    public Provider getProvider() {
        return provider;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
