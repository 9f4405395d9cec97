package com.phillippitts.answercoach.config.oracle;

import com.phillippitts.answercoach.exception.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Gemini REST settings, used when {@code coverage.oracle.provider=GEMINI}.
 */
@ConfigurationProperties(prefix = "gemini")
public class GeminiProperties {

    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final String embeddingModel;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    @ConstructorBinding
    public GeminiProperties(String apiKey, String baseUrl, String model, String embeddingModel,
                            Integer connectTimeoutMs, Integer readTimeoutMs) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.baseUrl = isBlank(baseUrl) ? "https://generativelanguage.googleapis.com" : baseUrl.trim();
        this.model = isBlank(model) ? "gemini-2.5-flash" : model.trim();
        this.embeddingModel = isBlank(embeddingModel) ? "text-embedding-004" : embeddingModel.trim();
        this.connectTimeoutMs = connectTimeoutMs == null ? 3_000 : connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs == null ? 8_000 : readTimeoutMs;
        if (this.connectTimeoutMs <= 0) {
            throw new ConfigurationException("gemini.connect-timeout-ms", "must be > 0");
        }
        if (this.readTimeoutMs <= 0) {
            throw new ConfigurationException("gemini.read-timeout-ms", "must be > 0");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }
}
