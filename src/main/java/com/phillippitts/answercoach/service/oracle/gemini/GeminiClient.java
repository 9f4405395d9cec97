package com.phillippitts.answercoach.service.oracle.gemini;

import com.phillippitts.answercoach.exception.OracleUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Objects;

/**
 * Minimal blocking client for the Gemini REST API ({@code v1beta}).
 *
 * <p>Only two calls are needed: {@code generateContent} with a JSON response type for the
 * classifiers, extractor and phrasing, and {@code batchEmbedContents} for similarity. Transport
 * errors, HTTP errors and unreadable bodies all surface as {@link OracleUnavailableException}.
 *
 * <p>The API key travels in the {@code x-goog-api-key} header configured on the {@link RestClient}.
 */
public class GeminiClient {

    private static final Logger LOG = LogManager.getLogger(GeminiClient.class);

    private final RestClient restClient;
    private final String model;
    private final String embeddingModel;

    public GeminiClient(RestClient restClient, String model, String embeddingModel) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = Objects.requireNonNull(model, "model");
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
    }

    /**
     * Sends one prompt and returns the model's text answer.
     *
     * @param oracle oracle name for error reporting
     * @param prompt prompt text
     * @return model output (expected to be JSON)
     * @throws OracleUnavailableException on any failure
     */
    public String generateJson(String oracle, String prompt) {
        JSONObject body = new JSONObject()
                .put("contents", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("parts", new JSONArray().put(new JSONObject().put("text", prompt)))))
                .put("generationConfig", new JSONObject()
                        .put("responseMimeType", "application/json")
                        .put("temperature", 0));
        String response = post(oracle, "/v1beta/models/" + model + ":generateContent", body);
        String text = GeminiJsonParser.candidateText(response);
        if (text == null) {
            throw new OracleUnavailableException("Gemini response had no candidate text", oracle);
        }
        return text;
    }

    /**
     * Embeds each text.
     *
     * @param oracle oracle name for error reporting
     * @param texts  texts to embed
     * @return one vector per text, same order
     * @throws OracleUnavailableException on any failure
     */
    public List<double[]> embed(String oracle, List<String> texts) {
        JSONArray requests = new JSONArray();
        for (String text : texts) {
            requests.put(new JSONObject()
                    .put("model", "models/" + embeddingModel)
                    .put("content", new JSONObject()
                            .put("parts", new JSONArray().put(new JSONObject().put("text", text)))));
        }
        JSONObject body = new JSONObject().put("requests", requests);
        String response = post(oracle, "/v1beta/models/" + embeddingModel + ":batchEmbedContents", body);
        List<double[]> vectors = GeminiJsonParser.embeddings(response);
        if (vectors == null || vectors.size() != texts.size()) {
            throw new OracleUnavailableException("Gemini embedding response malformed", oracle);
        }
        return vectors;
    }

    private String post(String oracle, String path, JSONObject body) {
        long t0 = System.nanoTime();
        try {
            String response = restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body.toString())
                    .retrieve()
                    .body(String.class);
            LOG.debug("Gemini {} answered in {} ms", path, (System.nanoTime() - t0) / 1_000_000L);
            if (response == null || response.isBlank()) {
                throw new OracleUnavailableException("Gemini returned an empty body", oracle);
            }
            return response;
        } catch (RestClientException e) {
            throw new OracleUnavailableException("Gemini call failed: " + e.getMessage(), oracle, e);
        }
    }
}
