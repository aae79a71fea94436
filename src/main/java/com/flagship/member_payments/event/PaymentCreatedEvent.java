package com.flagship.member_payments.event;

import com.flagship.member_payments.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A gateway order was opened and the payment is PENDING.
 */
@Value
public class PaymentCreatedEvent implements DomainEvent {
    UUID eventId;
    UUID paymentId;
    UUID userId;
    long amount;
    String currency;
    String paymentType;
    String gatewayOrderId;
    String description;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Payment";
    }

    @Override
    public UUID getAggregateId() {
        return paymentId;
    }

    public static PaymentCreatedEvent fromPayment(Payment payment) {
        return new PaymentCreatedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getUserId(),
            payment.getAmount(),
            payment.getCurrency().name(),
            payment.getType().name(),
            payment.getGatewayOrderId(),
            payment.getDescription(),
            payment.getCreatedAt()
        );
    }
}
