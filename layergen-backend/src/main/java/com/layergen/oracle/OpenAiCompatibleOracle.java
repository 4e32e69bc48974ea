package com.layergen.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.layergen.prompt.OracleRequest;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Oracle backed by an OpenAI-compatible chat completions endpoint (DeepSeek by default).
 *
 * <p>Plain HTTP requests, no vendor SDK, so any compatible gateway can be configured.
 */
@Component
public class OpenAiCompatibleOracle implements CodeOracle {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleOracle.class);

    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final ObjectMapper objectMapper;
    private final OracleConfig config;
    private final HttpClient httpClient;

    public OpenAiCompatibleOracle(ObjectMapper objectMapper, OracleConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether synthesis is enabled. The API key itself is never logged.
     */
    @PostConstruct
    public void logOracleConfigStatus() {
        if (config.isEnabled()) {
            log.info("Code synthesis is ENABLED (base_url={}, model={}, timeout_ms={}, max_attempts={})",
                    config.baseUrl(), config.model(), config.timeoutMs(), config.maxAttempts());
            return;
        }
        log.warn("Code synthesis is DISABLED (base_url={}, model={}): {}",
                config.baseUrl(), config.model(), config.getDisabledWarnings());
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public String complete(OracleRequest request) {
        if (!config.isEnabled()) {
            throw new OracleRejectedException("Oracle API key is not configured");
        }

        HttpResponse<String> response = send(buildHttpRequest(request));
        int status = response.statusCode();
        if (status == 429) {
            throw new OracleRateLimitedException("Oracle rate limit exceeded: HTTP 429", parseRetryAfter(response));
        }
        if (status == 408 || status >= 500) {
            throw new OracleUnavailableException("Oracle server error: HTTP " + status + " - " + abbreviate(response.body()));
        }
        if (status >= 400) {
            log.warn("Oracle rejected request (status_code={}, base_url={}, model={})", status, config.baseUrl(), config.model());
            throw new OracleRejectedException("Oracle rejected request: HTTP " + status + " - " + abbreviate(response.body()));
        }

        try {
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            if (!contentNode.isTextual()) {
                throw new MalformedResponseException("Oracle response has no message content");
            }
            return contentNode.asText();
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Oracle response is not valid JSON", e);
        }
    }

    private HttpRequest buildHttpRequest(OracleRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", config.model());
        payload.put("temperature", 0);
        payload.put("stream", false);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", request.getSystemPrompt()),
                Map.of("role", "user", "content", request.getUserPrompt())
        ));

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize oracle request", e);
        }

        return HttpRequest.newBuilder()
                .uri(completionsUri())
                .timeout(config.timeout())
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
    }

    /**
     * Accepts base URLs with or without the {@code /v1} suffix.
     */
    URI completionsUri() {
        String base = config.baseUrl();
        if (base.endsWith("/v1")) {
            return URI.create(base + "/chat/completions");
        }
        return URI.create(base + "/v1/chat/completions");
    }

    private HttpResponse<String> send(HttpRequest httpRequest) {
        try {
            return httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new OracleUnavailableException("Oracle call timed out after " + config.timeoutMs() + " ms", e);
        } catch (IOException e) {
            throw new OracleUnavailableException("Oracle call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("Interrupted while waiting for the oracle", e);
        }
    }

    private Duration parseRetryAfter(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After")
                .map(String::trim)
                .filter(v -> v.matches("\\d+"))
                .map(OpenAiCompatibleOracle::retryAfterSeconds)
                .orElse(null);
    }

    /**
     * Digit strings beyond {@code long} range mean "wait as long as allowed"; the retry policy
     * caps the delay at its maximum backoff.
     */
    static Duration retryAfterSeconds(String digits) {
        try {
            return Duration.ofSeconds(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            log.debug("Retry-After out of range, using maximum: value={}", digits);
            return Duration.ofSeconds(Long.MAX_VALUE);
        }
    }

    private String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY_CHARS ? body.substring(0, MAX_ERROR_BODY_CHARS) + "..." : body;
    }
}
