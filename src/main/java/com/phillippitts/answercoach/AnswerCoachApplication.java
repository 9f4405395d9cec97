package com.phillippitts.answercoach;

import com.phillippitts.answercoach.config.coverage.CoverageProperties;
import com.phillippitts.answercoach.config.oracle.GeminiProperties;
import com.phillippitts.answercoach.config.oracle.OracleProperties;
import com.phillippitts.answercoach.config.report.ReportSinkProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CoverageProperties.class,
        OracleProperties.class,
        GeminiProperties.class,
        ReportSinkProperties.class
})
public class AnswerCoachApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnswerCoachApplication.class, args);
    }

}
