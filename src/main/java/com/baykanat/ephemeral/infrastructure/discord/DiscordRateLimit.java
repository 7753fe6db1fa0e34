package com.baykanat.ephemeral.infrastructure.discord;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.HttpClientErrorException;

import java.time.Duration;

/**
 * Discord 429 yanıtları: bekleme süresi header'lardan okunur, istek aynı süre sonra tekrarlanır.
 * Bu bekleme bir hata retry'ı değildir; 429 dışındaki hiçbir hata tekrarlanmaz.
 */
public final class DiscordRateLimit {

    static final String RESET_AFTER_HEADER = "X-RateLimit-Reset-After";

    /** Header yoksa veya okunamazsa beklenen süre. */
    static final Duration DEFAULT_WAIT = Duration.ofSeconds(1);

    private DiscordRateLimit() {
    }

    /** Yalnızca 429'da, header'daki süre kadar (en fazla maxWait) bekleyip tekrarlayan Retry. */
    public static Retry retry(String name, RetryRegistry registry, int maxAttempts, Duration maxWait) {
        RetryConfig config = RetryConfig.<Object>custom()
                .maxAttempts(maxAttempts)
                .retryOnException(DiscordRateLimit::isRateLimited)
                .intervalBiFunction((attempt, outcome) -> outcome.isLeft()
                        ? waitMillis(outcome.getLeft(), maxWait)
                        : DEFAULT_WAIT.toMillis())
                .build();
        return registry.retry(name, config);
    }

    /** Hata zincirinde 429 var mı. */
    public static boolean isRateLimited(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof HttpClientErrorException.TooManyRequests) {
                return true;
            }
        }
        return false;
    }

    /** X-RateLimit-Reset-After, yoksa Retry-After (saniye, ondalıklı olabilir); maxWait ile sınırlı. */
    static long waitMillis(Throwable failure, Duration maxWait) {
        Duration wait = DEFAULT_WAIT;
        if (failure instanceof HttpClientErrorException.TooManyRequests tooManyRequests) {
            HttpHeaders headers = tooManyRequests.getResponseHeaders();
            if (headers != null) {
                Duration fromHeader = parseSeconds(headers.getFirst(RESET_AFTER_HEADER));
                if (fromHeader == null) {
                    fromHeader = parseSeconds(headers.getFirst(HttpHeaders.RETRY_AFTER));
                }
                if (fromHeader != null) {
                    wait = fromHeader;
                }
            }
        }
        return Math.min(wait.toMillis(), maxWait.toMillis());
    }

    private static Duration parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            return seconds < 0 ? null : Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
