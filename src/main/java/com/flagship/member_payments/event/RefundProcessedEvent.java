package com.flagship.member_payments.event;

import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentRefund;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A completed payment was refunded (fully or partially).
 */
@Value
public class RefundProcessedEvent implements DomainEvent {
    UUID eventId;
    UUID paymentId;
    UUID refundId;
    UUID userId;
    long refundAmount;
    String currency;
    String gatewayRefundId;
    String originalGatewayPaymentId;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RefundProcessed";

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

    public static RefundProcessedEvent of(Payment payment, PaymentRefund refund) {
        return new RefundProcessedEvent(
            UUID.randomUUID(),
            payment.getId(),
            refund.getId(),
            payment.getUserId(),
            refund.getAmount(),
            payment.getCurrency().name(),
            refund.getGatewayRefundId(),
            payment.getGatewayPaymentId(),
            refund.getReason(),
            refund.getProcessedAt()
        );
    }
}
