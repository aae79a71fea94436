package com.flagship.member_payments.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in (or already shipped from) the outbox.
 *
 * Written in the same transaction as the payment, invoice or statement change
 * it describes; published to Kafka later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Payment", "Invoice", "Statement"
    UUID aggregateId;
    String eventType;          // e.g. "PaymentCompleted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until shipped
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * Creates a new unpublished outbox event. The row id is the domain event id,
     * so consumers can deduplicate on either.
     */
    public static OutboxEvent create(UUID eventId, String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            eventId,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
