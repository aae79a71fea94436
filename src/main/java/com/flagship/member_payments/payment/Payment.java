package com.flagship.member_payments.payment;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Payment domain object.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Invalid transitions are rejected with IllegalStateException
 * - State changes are immutable (each transition returns a new Payment)
 * - gatewayPaymentId is present exactly when the payment is COMPLETED or REFUNDED
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    UUID userId;
    long amount;
    CurrencyCode currency;
    PaymentType type;
    PaymentGateway gateway;
    String gatewayOrderId;
    String gatewayPaymentId;
    PaymentStatus status;
    String description;
    String failureReason;
    Long refundAmount;
    String refundReason;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    Instant refundedAt;

    /**
     * Creates a new Payment in PENDING status for a gateway order.
     */
    public static Payment pending(UUID id, UUID userId, long amount, CurrencyCode currency,
                                  PaymentType type, PaymentGateway gateway,
                                  String gatewayOrderId, String description, Instant now) {
        return Payment.builder()
            .id(id)
            .userId(userId)
            .amount(amount)
            .currency(currency)
            .type(type)
            .gateway(gateway)
            .gatewayOrderId(gatewayOrderId)
            .status(PaymentStatus.PENDING)
            .description(description)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Transitions payment to COMPLETED status.
     * Only valid from PENDING status.
     *
     * @param gatewayPaymentId Reference issued by the gateway for the captured payment
     * @return New Payment instance with COMPLETED status
     * @throws IllegalStateException if transition is not allowed
     */
    public Payment complete(String gatewayPaymentId, Instant now) {
        if (this.status != PaymentStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot complete payment in %s status. Only PENDING payments can be completed.",
                    this.status)
            );
        }
        if (gatewayPaymentId == null || gatewayPaymentId.isBlank()) {
            throw new IllegalArgumentException("Gateway payment reference is required to complete a payment");
        }
        return toBuilder()
            .status(PaymentStatus.COMPLETED)
            .gatewayPaymentId(gatewayPaymentId)
            .completedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Transitions payment to FAILED status.
     * Only valid from PENDING status.
     *
     * @param reason Reason for failure
     * @return New Payment instance with FAILED status
     * @throws IllegalStateException if transition is not allowed
     */
    public Payment fail(String reason, Instant now) {
        if (this.status != PaymentStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot fail payment in %s status. Only PENDING payments can be failed.",
                    this.status)
            );
        }
        return toBuilder()
            .status(PaymentStatus.FAILED)
            .failureReason(reason)
            .updatedAt(now)
            .build();
    }

    /**
     * Transitions payment to REFUNDED status.
     * Only valid from COMPLETED status, for an amount between 1 and the original amount.
     *
     * @return New Payment instance with REFUNDED status
     * @throws IllegalStateException if the payment is not COMPLETED
     * @throws IllegalArgumentException if the amount is out of bounds
     */
    public Payment refund(long refundAmount, String reason, Instant now) {
        if (this.status != PaymentStatus.COMPLETED) {
            throw new IllegalStateException(
                String.format("Cannot refund payment in %s status. Only COMPLETED payments can be refunded.",
                    this.status)
            );
        }
        validateRefundAmount(refundAmount);
        return toBuilder()
            .status(PaymentStatus.REFUNDED)
            .refundAmount(refundAmount)
            .refundReason(reason)
            .refundedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Checks a refund amount against the original payment amount.
     *
     * @throws IllegalArgumentException if amount is not positive or exceeds the payment amount
     */
    public void validateRefundAmount(long refundAmount) {
        if (refundAmount <= 0) {
            throw new IllegalArgumentException("Refund amount must be positive");
        }
        if (refundAmount > this.amount) {
            throw new IllegalArgumentException(
                String.format("Refund amount %d exceeds payment amount %d", refundAmount, this.amount));
        }
    }

    /**
     * True when the gateway already confirmed this payment with the given reference.
     */
    public boolean isConfirmedWith(String gatewayPaymentId) {
        return (status == PaymentStatus.COMPLETED || status == PaymentStatus.REFUNDED)
            && this.gatewayPaymentId != null
            && this.gatewayPaymentId.equals(gatewayPaymentId);
    }

    /**
     * Checks if a transition from current status to target status is allowed.
     */
    public boolean canTransitionTo(PaymentStatus targetStatus) {
        if (this.status == targetStatus) {
            return true; // Same status is always allowed (idempotent)
        }

        return switch (this.status) {
            case PENDING -> targetStatus == PaymentStatus.COMPLETED || targetStatus == PaymentStatus.FAILED;
            case COMPLETED -> targetStatus == PaymentStatus.REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }
}
