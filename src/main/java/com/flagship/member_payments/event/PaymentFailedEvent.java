package com.flagship.member_payments.event;

import com.flagship.member_payments.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a payment transitions to FAILED status.
 */
@Value
public class PaymentFailedEvent implements DomainEvent {
    UUID eventId;
    UUID paymentId;
    UUID userId;
    long amount;
    String currency;
    String gatewayOrderId;
    String failureReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

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

    public static PaymentFailedEvent fromPayment(Payment payment) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getUserId(),
            payment.getAmount(),
            payment.getCurrency().name(),
            payment.getGatewayOrderId(),
            payment.getFailureReason(),
            payment.getUpdatedAt()
        );
    }
}
