package com.flagship.member_payments.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for domain events (payments, invoices, statements).
 *
 * Events are keyed by aggregate id, so three partitions keep per-aggregate ordering
 * while letting notification consumers run in parallel.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payments:member-payments.events}")
    private String eventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic memberPaymentEventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
