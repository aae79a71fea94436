package com.flagship.member_payments.payment;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of a refund issued for a payment. Returned by the refund endpoint.
 */
@Value
public class PaymentRefund {
    UUID id;
    UUID paymentId;
    long amount;
    String reason;
    String gatewayRefundId;
    String processedBy;
    Instant processedAt;

    public static PaymentRefund create(UUID paymentId, long amount, String reason,
                                       String gatewayRefundId, String processedBy, Instant now) {
        return new PaymentRefund(UUID.randomUUID(), paymentId, amount, reason,
                gatewayRefundId, processedBy, now);
    }
}
