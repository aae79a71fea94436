package com.flagship.member_payments.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA Entity for Payment persistence.
 *
 * Key design principles:
 * - No @Setter: state only changes through updateFromDomain()
 * - Immutable columns (amount, currency, user, gateway order) are updatable = false
 * - Lifecycle hooks manage created/updated timestamps
 * - The gateway payment reference can be bound once and never rebound
 *
 * The idempotency key is a persistence concern and is passed separately
 * in fromDomain().
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_payments_user_status_completed", columnList = "user_id, status, completed_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32, updatable = false)
    private PaymentType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32, updatable = false)
    private PaymentGateway gateway;

    @Column(name = "gateway_order_id", nullable = false, unique = true, updatable = false)
    private String gatewayOrderId;

    @Column(name = "gateway_payment_id", unique = true)
    private String gatewayPaymentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentStatus status;

    @Column(length = 500)
    private String description;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "refund_amount")
    private Long refundAmount;

    @Column(name = "refund_reason")
    private String refundReason;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Controlled factory method to create entity from domain object.
     * This is the ONLY way to create PaymentEntity instances.
     *
     * @param payment Domain payment object (PENDING)
     * @param idempotencyKey Optional client idempotency key
     */
    static PaymentEntity fromDomain(Payment payment, String idempotencyKey) {
        return new PaymentEntity(
            payment.getId(),
            payment.getUserId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getType(),
            payment.getGateway(),
            payment.getGatewayOrderId(),
            payment.getGatewayPaymentId(),
            payment.getStatus(),
            payment.getDescription(),
            payment.getFailureReason(),
            payment.getRefundAmount(),
            payment.getRefundReason(),
            idempotencyKey,
            payment.getCreatedAt(),
            null, // updatedAt - set by @PrePersist
            payment.getCompletedAt(),
            payment.getRefundedAt()
        );
    }

    /**
     * Converts entity to domain Payment object.
     */
    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .userId(userId)
            .amount(amount)
            .currency(currency)
            .type(type)
            .gateway(gateway)
            .gatewayOrderId(gatewayOrderId)
            .gatewayPaymentId(gatewayPaymentId)
            .status(status)
            .description(description)
            .failureReason(failureReason)
            .refundAmount(refundAmount)
            .refundReason(refundReason)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .completedAt(completedAt)
            .refundedAt(refundedAt)
            .build();
    }

    /**
     * Copies the mutable lifecycle fields from the domain object.
     *
     * @throws IllegalStateException if the transition is not allowed from the stored status,
     *         or if a different gateway payment reference is already bound
     */
    void updateFromDomain(Payment payment) {
        if (!toDomain().canTransitionTo(payment.getStatus())) {
            throw new IllegalStateException(
                "Payment " + id + " cannot move from " + status + " to " + payment.getStatus());
        }
        if (this.gatewayPaymentId != null
                && !Objects.equals(this.gatewayPaymentId, payment.getGatewayPaymentId())) {
            throw new IllegalStateException(
                "Gateway payment reference already bound for payment " + id + ". Cannot rebind.");
        }
        this.status = payment.getStatus();
        this.gatewayPaymentId = payment.getGatewayPaymentId();
        this.failureReason = payment.getFailureReason();
        this.refundAmount = payment.getRefundAmount();
        this.refundReason = payment.getRefundReason();
        this.completedAt = payment.getCompletedAt();
        this.refundedAt = payment.getRefundedAt();
    }
}
