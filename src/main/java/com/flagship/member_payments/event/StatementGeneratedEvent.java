package com.flagship.member_payments.event;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A financial statement finished rendering and is READY.
 */
@Value
public class StatementGeneratedEvent implements DomainEvent {
    UUID eventId;
    UUID statementId;
    UUID userId;
    String statementNumber;
    LocalDate dateFrom;
    LocalDate dateTo;
    String format;
    long netInvestment;
    String currency;
    String documentUrl;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StatementGenerated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Statement";
    }

    @Override
    public UUID getAggregateId() {
        return statementId;
    }
}
