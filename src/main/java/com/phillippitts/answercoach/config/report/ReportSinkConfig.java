package com.phillippitts.answercoach.config.report;

import com.phillippitts.answercoach.service.report.InMemoryReportSink;
import com.phillippitts.answercoach.service.report.JsonLinesReportSink;
import com.phillippitts.answercoach.service.report.ReportSink;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class ReportSinkConfig {

    @Bean
    public ReportSink reportSink(ReportSinkProperties props) {
        return switch (props.getType()) {
            case MEMORY -> new InMemoryReportSink();
            case JSONL -> new JsonLinesReportSink(Path.of(props.getPath()));
        };
    }
}
