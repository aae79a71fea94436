package com.flagship.member_payments.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.member_payments.event.InvoiceIssuedEvent;
import com.flagship.member_payments.event.PaymentCompletedEvent;
import com.flagship.member_payments.event.PaymentCreatedEvent;
import com.flagship.member_payments.event.PaymentFailedEvent;
import com.flagship.member_payments.event.RefundProcessedEvent;
import com.flagship.member_payments.event.StatementGeneratedEvent;
import com.flagship.member_payments.notification.NotificationEventHandler;
import com.flagship.member_payments.observability.PaymentMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Routes outbox event payloads to the notification handler, once per event.
 *
 * Independent of Kafka so the same path can be driven from a listener, a
 * replay tool or a test.
 */
@Component
@Slf4j
public class DomainEventRouter {

    private final IdempotentEventProcessor eventProcessor;
    private final NotificationEventHandler notificationHandler;
    private final PaymentMetrics metrics;
    private final ObjectMapper objectMapper;
    private final String consumerGroup;

    public DomainEventRouter(IdempotentEventProcessor eventProcessor,
                             NotificationEventHandler notificationHandler,
                             PaymentMetrics metrics,
                             ObjectMapper objectMapper,
                             @Value("${spring.kafka.consumer.group-id:member-payments-notifications}")
                             String consumerGroup) {
        this.eventProcessor = eventProcessor;
        this.notificationHandler = notificationHandler;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.consumerGroup = consumerGroup;
    }

    /**
     * @return true if the event was handled now, false if it was a duplicate,
     *         unknown or unparseable
     * @throws RuntimeException from the handler; the caller must not acknowledge
     */
    public boolean route(String payload) {
        EventEnvelope envelope = parseEnvelope(payload);
        if (envelope == null) {
            log.warn("Could not parse event envelope, skipping: {}", payload);
            return false;
        }

        try {
            boolean handled;
            switch (envelope.eventType) {
                case PaymentCreatedEvent.EVENT_TYPE:
                    handled = handle(envelope, payload, PaymentCreatedEvent.class, notificationHandler::onPaymentCreated);
                    break;
                case PaymentCompletedEvent.EVENT_TYPE:
                    handled = handle(envelope, payload, PaymentCompletedEvent.class,
                        notificationHandler::onPaymentCompleted);
                    break;
                case PaymentFailedEvent.EVENT_TYPE:
                    handled = handle(envelope, payload, PaymentFailedEvent.class, notificationHandler::onPaymentFailed);
                    break;
                case RefundProcessedEvent.EVENT_TYPE:
                    handled = handle(envelope, payload, RefundProcessedEvent.class,
                        notificationHandler::onRefundProcessed);
                    break;
                case InvoiceIssuedEvent.EVENT_TYPE:
                    handled = handle(envelope, payload, InvoiceIssuedEvent.class, notificationHandler::onInvoiceIssued);
                    break;
                case StatementGeneratedEvent.EVENT_TYPE:
                    handled = handle(envelope, payload, StatementGeneratedEvent.class,
                        notificationHandler::onStatementGenerated);
                    break;
                default:
                    eventProcessor.skipEvent(envelope.eventId, envelope.eventType, envelope.aggregateType,
                        envelope.aggregateId, consumerGroup, "No handler for event type");
                    handled = false;
            }
            metrics.recordEventProcessed(envelope.eventType, handled);
            return handled;

        } catch (RuntimeException e) {
            metrics.recordEventProcessingFailure(envelope.eventType, e.getClass().getSimpleName());
            throw e;
        }
    }

    private <E> boolean handle(EventEnvelope envelope, String payload, Class<E> type, Consumer<E> handler) {
        return eventProcessor.processEvent(envelope.eventId, envelope.eventType, envelope.aggregateType,
            envelope.aggregateId, consumerGroup, () -> handler.accept(deserialize(payload, type)));
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.hasNonNull("eventId") || !node.hasNonNull("eventType") || !node.hasNonNull("aggregateId")) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                node.get("eventType").asText(),
                node.path("aggregateType").asText("Unknown"),
                UUID.fromString(node.get("aggregateId").asText()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static final class EventEnvelope {
        private final UUID eventId;
        private final String eventType;
        private final String aggregateType;
        private final UUID aggregateId;

        private EventEnvelope(UUID eventId, String eventType, String aggregateType, UUID aggregateId) {
            this.eventId = eventId;
            this.eventType = eventType;
            this.aggregateType = aggregateType;
            this.aggregateId = aggregateId;
        }
    }
}
