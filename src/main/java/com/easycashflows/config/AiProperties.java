package com.easycashflows.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.ai")
public record AiProperties(
        String apiKey,
        String model,
        String baseUrl,
        Double confidenceThreshold,
        Double classificationTemperature,
        Double generationTemperature,
        Retry retry
) {

    public AiProperties {
        retry = retry == null ? new Retry(null, null, null) : retry;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String resolveModel() {
        return model == null || model.isBlank() ? "gpt-3.5-turbo" : model;
    }

    public String resolveBaseUrl() {
        return baseUrl == null || baseUrl.isBlank() ? "https://api.openai.com" : baseUrl;
    }

    public double resolveConfidenceThreshold() {
        return confidenceThreshold == null ? 0.7 : confidenceThreshold;
    }

    public double resolveClassificationTemperature() {
        return classificationTemperature == null ? 0.3 : classificationTemperature;
    }

    public double resolveGenerationTemperature() {
        return generationTemperature == null ? 0.7 : generationTemperature;
    }

    public record Retry(Integer maxAttempts, Long baseDelayMs, Long maxDelayMs) {

        public int resolveMaxAttempts() {
            return maxAttempts == null ? 3 : Math.max(1, maxAttempts);
        }

        public long resolveBaseDelayMs() {
            return baseDelayMs == null ? 1000L : baseDelayMs;
        }

        public long resolveMaxDelayMs() {
            return maxDelayMs == null ? 10000L : maxDelayMs;
        }
    }
}
