package com.baykanat.ephemeral.infrastructure.discord;

import com.baykanat.ephemeral.domain.store.MessageDeleteException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the 429 wait calculation and the rate-limit Retry.
 */
class DiscordRateLimitTest {

    private static final Duration MAX_WAIT = Duration.ofSeconds(30);

    private static HttpClientErrorException tooManyRequests(HttpHeaders headers) {
        return HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", headers,
                new byte[0], StandardCharsets.UTF_8);
    }

    private static HttpHeaders headers(String name, String value) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(name, value);
        return headers;
    }

    @Test
    @DisplayName("Fractional Retry-After should be converted to milliseconds")
    void retryAfterSeconds() {
        assertThat(DiscordRateLimit.waitMillis(tooManyRequests(headers(HttpHeaders.RETRY_AFTER, "0.1")), MAX_WAIT))
                .isEqualTo(100L);
    }

    @Test
    @DisplayName("X-RateLimit-Reset-After should win over Retry-After")
    void resetAfterPreferred() {
        HttpHeaders headers = headers(HttpHeaders.RETRY_AFTER, "5");
        headers.add(DiscordRateLimit.RESET_AFTER_HEADER, "1.25");

        assertThat(DiscordRateLimit.waitMillis(tooManyRequests(headers), MAX_WAIT)).isEqualTo(1250L);
    }

    @Test
    @DisplayName("Missing or unreadable headers should fall back to the default wait")
    void defaultWaitWithoutHeaders() {
        assertThat(DiscordRateLimit.waitMillis(tooManyRequests(new HttpHeaders()), MAX_WAIT))
                .isEqualTo(DiscordRateLimit.DEFAULT_WAIT.toMillis());
        assertThat(DiscordRateLimit.waitMillis(tooManyRequests(headers(HttpHeaders.RETRY_AFTER, "soon")), MAX_WAIT))
                .isEqualTo(DiscordRateLimit.DEFAULT_WAIT.toMillis());
    }

    @Test
    @DisplayName("Very long waits should be capped at the configured maximum")
    void waitIsCapped() {
        assertThat(DiscordRateLimit.waitMillis(tooManyRequests(headers(HttpHeaders.RETRY_AFTER, "3600")),
                Duration.ofSeconds(2))).isEqualTo(2000L);
    }

    @Test
    @DisplayName("429 should be detected through a wrapping domain exception")
    void rateLimitDetectedThroughCause() {
        MessageDeleteException wrapped = new MessageDeleteException(1L, List.of(2L), "failed",
                tooManyRequests(new HttpHeaders()));

        assertThat(DiscordRateLimit.isRateLimited(wrapped)).isTrue();
        assertThat(new RateLimitedExceptionPredicate().test(wrapped)).isTrue();
        assertThat(DiscordRateLimit.isRateLimited(
                HttpClientErrorException.create(HttpStatus.FORBIDDEN, "Forbidden", new HttpHeaders(),
                        new byte[0], StandardCharsets.UTF_8))).isFalse();
    }

    @Test
    @DisplayName("Retry should repeat only rate-limited calls")
    void retryRepeatsOnlyRateLimitedCalls() {
        Retry retry = DiscordRateLimit.retry("test", RetryRegistry.ofDefaults(), 3, MAX_WAIT);
        AtomicInteger calls = new AtomicInteger();

        String result = retry.executeSupplier(() -> {
            if (calls.incrementAndGet() == 1) {
                throw tooManyRequests(headers(HttpHeaders.RETRY_AFTER, "0.01"));
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(2);

        AtomicInteger forbiddenCalls = new AtomicInteger();
        assertThatThrownBy(() -> retry.executeRunnable(() -> {
            forbiddenCalls.incrementAndGet();
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(forbiddenCalls).hasValue(1);
    }
}
