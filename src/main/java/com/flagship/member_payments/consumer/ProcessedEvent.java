package com.flagship.member_payments.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event.
 *
 * Written in the same transaction as the handling, so a crash before commit
 * leaves no record and the redelivered event is handled again.
 */
@Value
public class ProcessedEvent {
    UUID id;
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant now) {
        return new ProcessedEvent(UUID.randomUUID(), eventId, eventType, aggregateType, aggregateId,
            consumerGroup, now, ProcessingResult.SUCCESS, null);
    }

    /**
     * An event this consumer has no handler for; recorded so replays skip it cheaply.
     */
    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, String reason, Instant now) {
        return new ProcessedEvent(UUID.randomUUID(), eventId, eventType, aggregateType, aggregateId,
            consumerGroup, now, ProcessingResult.SKIPPED, reason);
    }
}
