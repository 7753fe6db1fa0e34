package com.baykanat.ephemeral.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/** Listener seviyesinde kalan hatalar: exponential backoff retry, ardından gateway-events.DLT. */
@Slf4j
@Configuration
public class KafkaConsumerConfig {

    @Value("${app.kafka.topic.gateway-events}")
    private String gatewayEventsTopic;

    @SuppressWarnings("null")
    @Bean
    public CommonErrorHandler kafkaErrorHandler(KafkaOperations<?, ?> kafkaOperations) {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaOperations,
                (record, ex) -> {
                    log.warn("Gateway event at offset={} exhausted retries, routing to DLT: {}",
                            record.offset(), ex.getMessage());
                    return new TopicPartition(gatewayEventsTopic + ".DLT", record.partition());
                }
        );

        // Olaylar zaman hassas; kısa backoff, sonra DLT (uzlaştırma kaçanları zaten toparlar)
        ExponentialBackOff backOff = new ExponentialBackOff(1000L, 2.0);
        backOff.setMaxInterval(4000L);
        backOff.setMaxElapsedTime(4000L);

        return new DefaultErrorHandler(recoverer, backOff);
    }
}
