package com.phillippitts.answercoach.service.oracle.gemini;

import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.oracle.ConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.OracleNames;
import org.json.JSONObject;

import java.util.Locale;
import java.util.Objects;

/**
 * Speaker-confidence classifier backed by Gemini.
 */
public final class GeminiConfidenceOracle implements ConfidenceOracle {

    private final GeminiClient client;

    public GeminiConfidenceOracle(GeminiClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public ConfidenceVerdict classify(String latestFragmentText) {
        String out = client.generateJson(OracleNames.CONFIDENCE, GeminiPrompts.confidence(latestFragmentText));
        JSONObject json = GeminiJsonParser.parseObject(out);
        String state = json == null ? "" : json.optString("state", "").trim().toLowerCase(Locale.ROOT);
        return switch (state) {
            case "knows" -> ConfidenceVerdict.KNOWS;
            case "uncertain" -> ConfidenceVerdict.UNCERTAIN;
            case "does_not_know", "does not know" -> ConfidenceVerdict.DOES_NOT_KNOW;
            default -> throw new OracleUnavailableException("unexpected confidence state '" + state + "'",
                    OracleNames.CONFIDENCE);
        };
    }
}
