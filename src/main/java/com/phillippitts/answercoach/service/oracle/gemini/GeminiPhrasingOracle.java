package com.phillippitts.answercoach.service.oracle.gemini;

import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.oracle.OracleNames;
import com.phillippitts.answercoach.service.oracle.PhrasingOracle;
import org.json.JSONObject;

import java.util.List;
import java.util.Objects;

/**
 * Follow-up wording backed by Gemini.
 */
public final class GeminiPhrasingOracle implements PhrasingOracle {

    private final GeminiClient client;

    public GeminiPhrasingOracle(GeminiClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public String compose(String targetBulletText, List<String> uncoveredBulletTexts) {
        String out = client.generateJson(OracleNames.PHRASING,
                GeminiPrompts.phrasing(targetBulletText, uncoveredBulletTexts));
        JSONObject json = GeminiJsonParser.parseObject(out);
        String question = json == null ? "" : json.optString("question", "").trim();
        if (question.isEmpty()) {
            throw new OracleUnavailableException("no question in model output", OracleNames.PHRASING);
        }
        return question;
    }
}
