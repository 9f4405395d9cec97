package com.phillippitts.answercoach.service.oracle.gemini;

import com.phillippitts.answercoach.domain.Claim;
import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.oracle.ClaimOracle;
import com.phillippitts.answercoach.service.oracle.OracleNames;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Claim extractor backed by Gemini. Accepts either a bare array or an object with a
 * {@code claims} array.
 */
public final class GeminiClaimOracle implements ClaimOracle {

    private final GeminiClient client;

    public GeminiClaimOracle(GeminiClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public List<Claim> extract(String fragmentText) {
        String out = client.generateJson(OracleNames.CLAIM, GeminiPrompts.claims(fragmentText));
        JSONArray items = GeminiJsonParser.parseArray(out);
        if (items == null) {
            JSONObject wrapper = GeminiJsonParser.parseObject(out);
            items = wrapper == null ? null : wrapper.optJSONArray("claims");
        }
        if (items == null) {
            throw new OracleUnavailableException("claim list missing from model output", OracleNames.CLAIM);
        }
        List<Claim> claims = new ArrayList<>();
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.optJSONObject(i);
            if (item == null) {
                continue;
            }
            String text = item.optString("claim", "").trim();
            if (text.isEmpty()) {
                continue;
            }
            List<String> entities = new ArrayList<>();
            JSONArray ents = item.optJSONArray("entities");
            if (ents != null) {
                for (int j = 0; j < ents.length(); j++) {
                    String e = ents.optString(j, "").trim();
                    if (!e.isEmpty()) {
                        entities.add(e);
                    }
                }
            }
            String predicate = item.optString("predicate", "").trim();
            claims.add(new Claim(text, entities, predicate.isEmpty() ? null : predicate, null, 0.0));
        }
        return claims;
    }
}
