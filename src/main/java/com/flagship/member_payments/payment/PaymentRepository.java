package com.flagship.member_payments.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Payment persistence.
 *
 * The ForUpdate finders take a row-level write lock; every state transition
 * goes through one of them so transitions for one payment are serialized.
 */
@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    List<PaymentEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id")
    Optional<PaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.gatewayOrderId = :orderId")
    Optional<PaymentEntity> findByGatewayOrderIdForUpdate(@Param("orderId") String gatewayOrderId);

    /**
     * Completed payments for a member whose completion falls in [from, to).
     * Source rows for financial statements.
     */
    @Query("""
        SELECT p FROM PaymentEntity p
        WHERE p.userId = :userId
        AND p.currency = :currency
        AND p.status = com.flagship.member_payments.payment.PaymentStatus.COMPLETED
        AND p.completedAt >= :from AND p.completedAt < :to
        ORDER BY p.completedAt ASC
        """)
    List<PaymentEntity> findCompletedBetween(@Param("userId") UUID userId,
                                             @Param("currency") CurrencyCode currency,
                                             @Param("from") Instant from,
                                             @Param("to") Instant to);

    /**
     * Total refunded to a member in [from, to), by refund timestamp.
     */
    @Query("""
        SELECT COALESCE(SUM(p.refundAmount), 0L) FROM PaymentEntity p
        WHERE p.userId = :userId
        AND p.currency = :currency
        AND p.status = com.flagship.member_payments.payment.PaymentStatus.REFUNDED
        AND p.refundedAt >= :from AND p.refundedAt < :to
        """)
    Long sumRefundedBetween(@Param("userId") UUID userId,
                            @Param("currency") CurrencyCode currency,
                            @Param("from") Instant from,
                            @Param("to") Instant to);
}
