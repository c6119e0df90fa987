package com.extractpilot.orchestrator.claude;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClaudeClientTest {

    @Test
    void isRetryable_rateLimitOverloadAndServerErrors() {
        assertThat(ClaudeClient.isRetryable(429)).isTrue();
        assertThat(ClaudeClient.isRetryable(529)).isTrue();
        assertThat(ClaudeClient.isRetryable(500)).isTrue();
        assertThat(ClaudeClient.isRetryable(503)).isTrue();
    }

    @Test
    void isRetryable_clientErrors_notRetried() {
        assertThat(ClaudeClient.isRetryable(400)).isFalse();
        assertThat(ClaudeClient.isRetryable(401)).isFalse();
        assertThat(ClaudeClient.isRetryable(404)).isFalse();
    }

    @Test
    void apiException_carriesStatus() {
        ClaudeClient.ClaudeApiException e = new ClaudeClient.ClaudeApiException(429, "slow down");

        assertThat(e.statusCode()).isEqualTo(429);
        assertThat(e.getMessage()).isEqualTo("Claude API error 429: slow down");
    }
}
