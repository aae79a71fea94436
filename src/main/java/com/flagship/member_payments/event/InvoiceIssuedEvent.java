package com.flagship.member_payments.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An invoice document was rendered and stored; the link is now available.
 */
@Value
public class InvoiceIssuedEvent implements DomainEvent {
    UUID eventId;
    UUID invoiceId;
    UUID paymentId;
    UUID userId;
    String invoiceNumber;
    long totalAmount;
    String currency;
    String documentUrl;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceIssued";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Invoice";
    }

    @Override
    public UUID getAggregateId() {
        return invoiceId;
    }
}
