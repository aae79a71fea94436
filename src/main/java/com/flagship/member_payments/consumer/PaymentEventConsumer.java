package com.flagship.member_payments.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka listener for the member-payments event topic.
 *
 * Manual acknowledgment: the offset is committed only after the event was
 * handled (or recognised as a duplicate). A handler failure leaves the message
 * unacknowledged and it is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaymentEventConsumer {

    private final DomainEventRouter router;

    @KafkaListener(
        topics = "${kafka.topic.payments:member-payments.events}",
        groupId = "${spring.kafka.consumer.group-id:member-payments-notifications}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());
        try {
            boolean handled = router.route(record.value());
            ack.acknowledge();
            if (handled) {
                log.info("Handled event at offset {} for aggregate {}", record.offset(), record.key());
            }
        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }
}
