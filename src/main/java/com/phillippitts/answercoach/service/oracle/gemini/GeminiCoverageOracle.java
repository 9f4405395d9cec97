package com.phillippitts.answercoach.service.oracle.gemini;

import com.phillippitts.answercoach.domain.CoverageVerdict;
import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.oracle.CoverageOracle;
import com.phillippitts.answercoach.service.oracle.OracleNames;
import org.json.JSONObject;

import java.util.Locale;
import java.util.Objects;

/**
 * Ternary coverage classifier backed by Gemini. Accepts "complete" as a synonym of "covered".
 */
public final class GeminiCoverageOracle implements CoverageOracle {

    private final GeminiClient client;

    public GeminiCoverageOracle(GeminiClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CoverageVerdict classify(String bulletText, String fullAnswerText) {
        String out = client.generateJson(OracleNames.COVERAGE, GeminiPrompts.coverage(bulletText, fullAnswerText));
        JSONObject json = GeminiJsonParser.parseObject(out);
        String status = json == null ? "" : json.optString("status", "").trim().toLowerCase(Locale.ROOT);
        return switch (status) {
            case "covered", "complete" -> CoverageVerdict.COVERED;
            case "partial" -> CoverageVerdict.PARTIAL;
            case "incomplete" -> CoverageVerdict.INCOMPLETE;
            case "uncovered" -> CoverageVerdict.UNCOVERED;
            default -> throw new OracleUnavailableException("unexpected coverage status '" + status + "'",
                    OracleNames.COVERAGE);
        };
    }
}
