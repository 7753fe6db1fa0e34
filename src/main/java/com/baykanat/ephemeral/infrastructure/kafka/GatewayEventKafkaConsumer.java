package com.baykanat.ephemeral.infrastructure.kafka;

import com.baykanat.ephemeral.api.dto.GatewayEventRequest;
import com.baykanat.ephemeral.domain.mapper.GatewayEventMapper;
import com.baykanat.ephemeral.domain.model.GatewayEvent;
import com.baykanat.ephemeral.domain.service.EphemeralMessageHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.serializer.SerializationUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** gateway-events topic'ten batch tüketir; her olayı EphemeralMessageHandler'a yönlendirir. Hatalı kayıtlar DLT'ye. */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayEventKafkaConsumer {

    private final EphemeralMessageHandler messageHandler;
    private final GatewayEventMapper gatewayEventMapper;
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${app.kafka.topic.gateway-events}")
    private String gatewayEventsTopic;

    /** Batch alır; deserialize veya dispatch hataları DLT'ye, geçerli olaylar handler'a. İşlem sonrası manuel ack. */
    @KafkaListener(
            topics = "${app.kafka.topic.gateway-events}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, Object>> records, Acknowledgment acknowledgment) {
        log.debug("Received batch of {} records from gateway-events topic", records.size());

        int dispatched = 0;
        int dltCount = 0;

        for (ConsumerRecord<String, Object> record : records) {
            if (hasDeserializationError(record)) {
                log.error("Kafka deserialization failed for record at offset={}, partition={}",
                        record.offset(), record.partition());
                publishToDlt(record, "Kafka-level deserialization failure");
                dltCount++;
                continue;
            }

            try {
                GatewayEventRequest request = gatewayEventMapper.fromRecordValue(record.value());
                if (request == null || request.getType() == null || !request.isTargetPresent()) {
                    publishToDlt(record, "Missing event type or target ids");
                    dltCount++;
                    continue;
                }
                dispatch(gatewayEventMapper.toGatewayEvent(request));
                dispatched++;
            } catch (Exception e) {
                log.error("Failed to handle record at offset={}, partition={}: {}",
                        record.offset(), record.partition(), e.getMessage());
                publishToDlt(record, e.getMessage());
                dltCount++;
            }
        }

        if (dispatched > 0) {
            log.info("Batch processed: {} records received, {} events dispatched, {} sent to DLT",
                    records.size(), dispatched, dltCount);
        } else if (dltCount > 0) {
            log.warn("All {} records in batch failed, {} sent to DLT", records.size(), dltCount);
        }

        // İşlem sonrası ack (DLT'ye gidenler dahil)
        acknowledgment.acknowledge();
    }

    /** Olay türüne göre handler giriş noktası; uzlaştırma asenkron, consumer thread'i beklemez. */
    void dispatch(GatewayEvent event) {
        switch (event.getType()) {
            case MESSAGE_CREATED -> messageHandler.onMessageCreated(
                    event.getMessageId(), event.getChannelId(),
                    Objects.requireNonNullElseGet(event.getCreatedAt(), Instant::now), event.isPinned());
            case PINS_UPDATED -> messageHandler.onPinsUpdated(event.getChannelId(), event.getLastPinTimestamp());
            case READY -> messageHandler.onConnectionReady();
            case RESUMED -> messageHandler.onConnectionResumed();
        }
    }

    /** ErrorHandlingDeserializer hata durumunda value'yu null bırakıp bu header'ı set eder. */
    private boolean hasDeserializationError(ConsumerRecord<String, Object> record) {
        Headers headers = record.headers();
        return headers.lastHeader(SerializationUtils.VALUE_DESERIALIZER_EXCEPTION_HEADER) != null;
    }

    /** Başarısız kaydı DLT topic'ine gönderir. DLT gönderimi hata verirse sadece log, batch devam eder. */
    private void publishToDlt(ConsumerRecord<String, Object> record, String reason) {
        String topic = Objects.requireNonNull(gatewayEventsTopic, "gatewayEventsTopic") + ".DLT";
        try {
            String key = Objects.requireNonNullElse(record.key(), "");
            kafkaTemplate.send(topic, key, record.value());
            log.warn("Sent failed record to DLT: topic={}, offset={}, partition={}, reason={}",
                    topic, record.offset(), record.partition(), Objects.requireNonNullElse(reason, ""));
        } catch (Exception dltEx) {
            log.error("Failed to publish record to DLT {}: {}", topic, dltEx.getMessage());
        }
    }
}
