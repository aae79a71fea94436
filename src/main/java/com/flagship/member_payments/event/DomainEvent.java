package com.flagship.member_payments.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact recorded in the outbox in the same transaction as the change it describes.
 *
 * Consumers deduplicate on the event id, so an event must keep its id across
 * redeliveries. The aggregate id doubles as the Kafka key.
 */
public interface DomainEvent {

    UUID getEventId();

    /**
     * "Payment", "Invoice" or "Statement".
     */
    String getAggregateType();

    UUID getAggregateId();

    /**
     * Member the event concerns; notification routing starts here.
     */
    UUID getUserId();

    Instant getOccurredAt();

    String getEventType();
}
