package com.phillippitts.answercoach.service.oracle.gemini;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient parsing of Gemini REST responses and of the JSON the model writes into them.
 *
 * <p>Returns {@code null} for anything it cannot read; callers turn that into an oracle failure.
 */
final class GeminiJsonParser {

    private GeminiJsonParser() {}

    /**
     * Concatenated text parts of the first candidate of a generateContent response.
     *
     * @param responseBody raw HTTP body
     * @return model text, or null if the response has none
     */
    static String candidateText(String responseBody) {
        JSONObject root = parseObject(responseBody);
        if (root == null) {
            return null;
        }
        JSONArray candidates = root.optJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        JSONObject first = candidates.optJSONObject(0);
        JSONObject content = first == null ? null : first.optJSONObject("content");
        JSONArray parts = content == null ? null : content.optJSONArray("parts");
        if (parts == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length(); i++) {
            JSONObject part = parts.optJSONObject(i);
            if (part != null) {
                sb.append(part.optString("text", ""));
            }
        }
        String text = sb.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Embedding vectors of a batchEmbedContents response, request order.
     *
     * @return vectors, or null when malformed
     */
    static List<double[]> embeddings(String responseBody) {
        JSONObject root = parseObject(responseBody);
        JSONArray embeddings = root == null ? null : root.optJSONArray("embeddings");
        if (embeddings == null) {
            return null;
        }
        List<double[]> out = new ArrayList<>(embeddings.length());
        for (int i = 0; i < embeddings.length(); i++) {
            JSONObject e = embeddings.optJSONObject(i);
            JSONArray values = e == null ? null : e.optJSONArray("values");
            if (values == null || values.isEmpty()) {
                return null;
            }
            double[] v = new double[values.length()];
            for (int j = 0; j < v.length; j++) {
                v[j] = values.optDouble(j, Double.NaN);
                if (Double.isNaN(v[j])) {
                    return null;
                }
            }
            out.add(v);
        }
        return out;
    }

    /**
     * Parses model output that should be a JSON object. Markdown code fences and text around the
     * outermost braces are ignored.
     */
    static JSONObject parseObject(String text) {
        String body = extract(text, '{', '}');
        if (body == null) {
            return null;
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            return null;
        }
    }

    /**
     * Parses model output that should be a JSON array, with the same leniency as {@link #parseObject}.
     */
    static JSONArray parseArray(String text) {
        String body = extract(text, '[', ']');
        if (body == null) {
            return null;
        }
        try {
            return new JSONArray(body);
        } catch (JSONException e) {
            return null;
        }
    }

    static String stripFences(String text) {
        String t = text.strip();
        if (t.startsWith("```")) {
            int firstNewline = t.indexOf('\n');
            t = firstNewline < 0 ? "" : t.substring(firstNewline + 1);
            int closing = t.lastIndexOf("```");
            if (closing >= 0) {
                t = t.substring(0, closing);
            }
        }
        return t.strip();
    }

    private static String extract(String text, char open, char close) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String t = stripFences(text);
        int start = t.indexOf(open);
        int end = t.lastIndexOf(close);
        if (start < 0 || end < start) {
            return null;
        }
        return t.substring(start, end + 1);
    }
}
