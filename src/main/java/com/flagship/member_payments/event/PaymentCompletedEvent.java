package com.flagship.member_payments.event;

import com.flagship.member_payments.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The gateway confirmed the payment: PENDING to COMPLETED.
 */
@Value
public class PaymentCompletedEvent implements DomainEvent {
    UUID eventId;
    UUID paymentId;
    UUID userId;
    long amount;
    String currency;
    String paymentType;
    String gatewayOrderId;
    String gatewayPaymentId;
    Instant completedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentCompleted";

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

    public static PaymentCompletedEvent fromPayment(Payment payment) {
        return new PaymentCompletedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getUserId(),
            payment.getAmount(),
            payment.getCurrency().name(),
            payment.getType().name(),
            payment.getGatewayOrderId(),
            payment.getGatewayPaymentId(),
            payment.getCompletedAt(),
            payment.getCompletedAt()
        );
    }
}
