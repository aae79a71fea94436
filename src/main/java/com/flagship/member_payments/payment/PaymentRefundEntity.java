package com.flagship.member_payments.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the payment_refunds table. Rows are written once and never updated.
 */
@Entity
@Table(name = "payment_refunds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentRefundEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_id", nullable = false, updatable = false)
    private UUID paymentId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(nullable = false, updatable = false)
    private String reason;

    @Column(name = "gateway_refund_id", updatable = false)
    private String gatewayRefundId;

    @Column(name = "processed_by", updatable = false)
    private String processedBy;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    static PaymentRefundEntity fromDomain(PaymentRefund refund) {
        return new PaymentRefundEntity(
            refund.getId(),
            refund.getPaymentId(),
            refund.getAmount(),
            refund.getReason(),
            refund.getGatewayRefundId(),
            refund.getProcessedBy(),
            refund.getProcessedAt()
        );
    }

    public PaymentRefund toDomain() {
        return new PaymentRefund(id, paymentId, amount, reason, gatewayRefundId, processedBy, processedAt);
    }
}
