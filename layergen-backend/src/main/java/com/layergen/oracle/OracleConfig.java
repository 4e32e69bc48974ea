package com.layergen.oracle;

import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.List;

/**
 * Oracle endpoint and retry settings resolved from Spring properties, falling back to environment
 * variables. The API key is never logged.
 */
public record OracleConfig(
        String baseUrl,
        String apiKey,
        String model,
        int timeoutMs,
        int maxAttempts,
        long initialBackoffMs,
        long maxBackoffMs
) {
    static final String DEFAULT_BASE_URL = "https://api.deepseek.com";
    static final String DEFAULT_MODEL = "deepseek-chat";
    static final int DEFAULT_TIMEOUT_MS = 120_000;
    static final int DEFAULT_MAX_ATTEMPTS = 4;
    static final long DEFAULT_INITIAL_BACKOFF_MS = 1_000;
    static final long DEFAULT_MAX_BACKOFF_MS = 30_000;

    public static OracleConfig fromEnvironment(Environment environment) {
        String baseUrl = getTrimmed(environment, "layergen.oracle.base-url", "AI_BASE_URL");
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        String apiKey = getTrimmed(environment, "layergen.oracle.api-key", "DEEPSEEK_API_KEY");
        if (apiKey == null || apiKey.isBlank()) {
            apiKey = getTrimmed(environment, null, "API_KEY");
        }
        String model = getTrimmed(environment, "layergen.oracle.model", "LLM_MODEL");
        if (model == null || model.isBlank()) {
            model = DEFAULT_MODEL;
        }

        return new OracleConfig(
                stripTrailingSlash(baseUrl),
                apiKey,
                model,
                getInt(environment, "layergen.oracle.timeout-ms", DEFAULT_TIMEOUT_MS),
                Math.max(1, getInt(environment, "layergen.oracle.max-attempts", DEFAULT_MAX_ATTEMPTS)),
                getInt(environment, "layergen.oracle.initial-backoff-ms", (int) DEFAULT_INITIAL_BACKOFF_MS),
                getInt(environment, "layergen.oracle.max-backoff-ms", (int) DEFAULT_MAX_BACKOFF_MS)
        );
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs));
    }

    List<String> getDisabledWarnings() {
        return List.of(
                "Code synthesis is disabled - no oracle API key configured",
                "Required: layergen.oracle.api-key or env DEEPSEEK_API_KEY / API_KEY",
                "Optional: AI_BASE_URL, LLM_MODEL, layergen.oracle.timeout-ms, layergen.oracle.max-attempts"
        );
    }

    @Override
    public String toString() {
        return "OracleConfig(baseUrl=" + baseUrl + ", model=" + model + ", apiKeyConfigured=" + isEnabled()
                + ", timeoutMs=" + timeoutMs + ", maxAttempts=" + maxAttempts + ")";
    }

    private static int getInt(Environment environment, String propKey, int defaultValue) {
        String raw = getTrimmed(environment, propKey, null);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + propKey + ": " + raw, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String v = url;
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static String getTrimmed(Environment environment, String propKey, String envKey) {
        String v = null;
        if (environment != null && propKey != null && !propKey.isBlank()) {
            v = environment.getProperty(propKey);
        }
        if ((v == null || v.isBlank()) && envKey != null && !envKey.isBlank()) {
            v = environment != null ? environment.getProperty(envKey) : null;
        }
        if (v == null) {
            return null;
        }
        return v.trim();
    }
}
