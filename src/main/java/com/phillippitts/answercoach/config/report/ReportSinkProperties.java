package com.phillippitts.answercoach.config.report;

import com.phillippitts.answercoach.exception.ConfigurationException;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "report.sink")
public class ReportSinkProperties {

    public enum Type { MEMORY, JSONL }

    /** Where finalized session reports go. */
    @NotNull
    private final Type type;

    /** Target file for JSONL reports. */
    private final String path;

    @ConstructorBinding
    public ReportSinkProperties(Type type, String path) {
        this.type = type == null ? Type.MEMORY : type;
        this.path = path == null || path.isBlank() ? "reports/sessions.jsonl" : path.trim();
        if (this.type == Type.JSONL && this.path.endsWith("/")) {
            throw new ConfigurationException("report.sink.path", "must name a file, got directory " + this.path);
        }
    }

    public Type getType() {
        return type;
    }

    public String getPath() {
        return path;
    }
}
