package com.extractpilot.orchestrator.claude;

import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Both the step workers and the judge talk to the model through this class.
 * Rate limits (429) and overloaded/5xx answers are retried with a linear
 * backoff up to {@code extractpilot.claude.max-attempts}; anything else is
 * surfaced as {@link ClaudeApiException} and counted by the caller as a
 * failed attempt.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant".
     */
    public record Message(String role, String content) {

        public static Message user(String content) {
            return new Message("user", content);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final ExtractPilotProperties.Claude settings;

    public ClaudeClient(ExtractPilotProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getClaude();
        this.json     = objectMapper;
        this.http     = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation and return the assistant's text reply.
     *
     * @param model    e.g. "claude-sonnet-4-6"
     * @param system   system prompt, may be null
     * @param messages the conversation so far
     * @throws ClaudeApiException on a non-retryable status or when retries run out
     */
    public String complete(String model, String system, List<Message> messages) {
        String requestBody = requestBody(model, system, messages);
        int maxAttempts = Math.max(1, settings.getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            HttpResponse<String> response = send(requestBody);
            int status = response.statusCode();
            if (status == 200) {
                try {
                    return json.readValue(response.body(), MessagesResponse.class).firstText();
                } catch (IOException | IllegalStateException e) {
                    throw new ClaudeApiException(status, "Unreadable response body: " + e.getMessage());
                }
            }
            if (!isRetryable(status) || attempt >= maxAttempts) {
                throw new ClaudeApiException(status, response.body());
            }
            Duration wait = settings.getBackoff().multipliedBy(attempt);
            log.warn("Claude API returned {} (attempt {}/{}), retrying in {} ms",
                    status, attempt, maxAttempts, wait.toMillis());
            sleep(wait);
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private String requestBody(String model, String system, List<Message> messages) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",      model);
        body.put("max_tokens", settings.getMaxTokens());
        if (system != null && !system.isBlank()) {
            body.put("system", system);
        }
        body.put("messages", messages);
        try {
            return json.writeValueAsString(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not serialise Claude request", e);
        }
    }

    private HttpResponse<String> send(String requestBody) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(settings.getBaseUrl() + "/v1/messages"))
                .timeout(settings.getTimeout())
                .header("content-type",      "application/json")
                .header("x-api-key",         settings.getApiKey() == null ? "" : settings.getApiKey())
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ClaudeApiException(-1, "Transport error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaudeApiException(-1, "Interrupted while waiting for Claude");
        }
    }

    static boolean isRetryable(int status) {
        return status == 429 || status == 529 || status >= 500;
    }

    private static void sleep(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaudeApiException(-1, "Interrupted during retry backoff");
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
