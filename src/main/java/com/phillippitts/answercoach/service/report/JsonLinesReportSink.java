package com.phillippitts.answercoach.service.report;

import com.phillippitts.answercoach.domain.SessionReport;
import com.phillippitts.answercoach.exception.AnswerCoachException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends one JSON object per line to a file. Existing lines are never touched.
 */
public final class JsonLinesReportSink implements ReportSink {

    private static final Logger LOG = LogManager.getLogger(JsonLinesReportSink.class);

    private final Path path;

    public JsonLinesReportSink(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public synchronized void append(SessionReport report) {
        String line = SessionReportJson.toJson(report).toString() + System.lineSeparator();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            LOG.debug("Report for session {} appended to {}", report.sessionId(), path);
        } catch (IOException e) {
            throw new AnswerCoachException("Failed to append report to " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }
}
