package com.baykanat.ephemeral.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.util.Objects;

/** gateway-events ve DLT topic bean'leri. */
@Configuration
public class KafkaProducerConfig {

    @Value("${app.kafka.topic.gateway-events}")
    private String gatewayEventsTopic;

    /** Ana topic; key kanal id olduğundan aynı kanalın olayları tek partition'da sıralı kalır. */
    @Bean
    public NewTopic gatewayEventsTopic() {
        return TopicBuilder.name(Objects.requireNonNull(gatewayEventsTopic, "gatewayEventsTopic"))
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic gatewayEventsDlt() {
        return TopicBuilder.name(Objects.requireNonNull(gatewayEventsTopic, "gatewayEventsTopic") + ".DLT")
                .partitions(1)
                .replicas(1)
                .build();
    }
}
