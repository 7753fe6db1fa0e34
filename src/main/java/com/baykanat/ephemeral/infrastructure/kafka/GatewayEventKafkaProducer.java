package com.baykanat.ephemeral.infrastructure.kafka;

import com.baykanat.ephemeral.api.dto.GatewayEventRequest;
import com.baykanat.ephemeral.config.AppProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/** Gateway olaylarını Kafka'ya gönderir; Retry + Circuit Breaker. Partition key kanal id (aynı kanal sıralı). */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayEventKafkaProducer {

    /** Kanalsız bağlantı olayları (READY/RESUMED) için partition key. */
    static final String CONNECTION_EVENT_KEY = "gateway";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;

    /** Tek olay gönderir; ack beklenir (acks=all). */
    @Retry(name = "kafkaProducer")
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleCircuitBreakerOpen")
    public void send(GatewayEventRequest event) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getGatewayEvents());
        kafkaTemplate.send(topic, keyOf(event), event).get(1, TimeUnit.SECONDS);
    }

    /** Toplu olayları paralel gönderir; tüm ack'ler paralel beklenir. */
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleBatchCircuitBreakerOpen")
    public void sendBatch(List<GatewayEventRequest> events) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getGatewayEvents());

        List<CompletableFuture<SendResult<String, Object>>> futures = events.stream()
                .map(event -> kafkaTemplate.send(topic, keyOf(event), event))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(10, TimeUnit.SECONDS);
    }

    static String keyOf(GatewayEventRequest event) {
        return event.getChannelId() != null ? event.getChannelId() : CONNECTION_EVENT_KEY;
    }

    /** Circuit breaker açıkken tek olay için 503 + Retry-After. */
    @SuppressWarnings("unused")
    private void handleCircuitBreakerOpen(GatewayEventRequest event, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting {} event for channel_id={}",
                event.getType(), event.getChannelId());
        throw new ServiceUnavailableException(
                "Gateway event intake is temporarily unavailable. Kafka circuit breaker is open.", 30);
    }

    /** Tek olay için tüm retry'lar tükendikten sonra fallback. */
    @SuppressWarnings("unused")
    private void handleCircuitBreakerOpen(GatewayEventRequest event, Exception ex) {
        log.error("Kafka produce failed after all retries for {} event, channel_id={}: {}",
                event.getType(), event.getChannelId(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Gateway event intake is temporarily unavailable. " + ex.getMessage(), 30);
    }

    /** Toplu gönderimde circuit breaker açıkken fallback. */
    @SuppressWarnings("unused")
    private void handleBatchCircuitBreakerOpen(List<GatewayEventRequest> events, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting batch of {} gateway events", events.size());
        throw new ServiceUnavailableException(
                "Gateway event intake is temporarily unavailable. Kafka circuit breaker is open.", 30);
    }

    /** Toplu gönderim hatasında fallback. */
    @SuppressWarnings("unused")
    private void handleBatchCircuitBreakerOpen(List<GatewayEventRequest> events, Exception ex) {
        log.error("Kafka batch produce failed for {} gateway events: {}", events.size(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Gateway event intake is temporarily unavailable. " + ex.getMessage(), 30);
    }

    /** Circuit breaker açık veya Kafka yok; GlobalExceptionHandler 503 + Retry-After döner. */
    public static class ServiceUnavailableException extends RuntimeException {
        private final int retryAfterSeconds;

        public ServiceUnavailableException(String message, int retryAfterSeconds) {
            super(message);
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}
