package com.flagship.member_payments.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for payment persistence operations.
 *
 * Bridges the domain layer (Payment, PaymentRefund) and the JPA entities.
 * Locking reads require an existing transaction: the lock must live as long
 * as the transition that follows it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;
    private final PaymentRefundRepository refundRepository;

    /**
     * Saves a new payment.
     *
     * @param payment Domain payment object
     * @param idempotencyKey Client idempotency key, may be null
     * @return The stored payment
     */
    @Transactional
    public Payment save(Payment payment, String idempotencyKey) {
        PaymentEntity entity = PaymentEntity.fromDomain(payment, idempotencyKey);
        PaymentEntity saved = paymentRepository.save(entity);
        log.debug("Saved payment {} for order {}", saved.getId(), saved.getGatewayOrderId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId)
            .map(PaymentEntity::toDomain);
    }

    /**
     * Loads a payment under a row-level write lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Payment> lockById(UUID paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId)
            .map(PaymentEntity::toDomain);
    }

    /**
     * Loads a payment by gateway order reference under a row-level write lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Payment> lockByGatewayOrderId(String gatewayOrderId) {
        return paymentRepository.findByGatewayOrderIdForUpdate(gatewayOrderId)
            .map(PaymentEntity::toDomain);
    }

    /**
     * Persists a transition of an existing payment.
     *
     * Uses the controlled update method on the entity, which re-checks the
     * transition against the stored status.
     *
     * @param payment Domain payment object (must have existing ID)
     * @return The stored payment
     */
    @Transactional
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> new IllegalArgumentException("Payment not found: " + payment.getId()));

        existing.updateFromDomain(payment);

        PaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated payment {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional
    public PaymentRefund saveRefund(PaymentRefund refund) {
        return refundRepository.save(PaymentRefundEntity.fromDomain(refund)).toDomain();
    }

    @Transactional(readOnly = true)
    public List<PaymentRefund> findRefunds(UUID paymentId) {
        return refundRepository.findByPaymentIdOrderByProcessedAtAsc(paymentId).stream()
            .map(PaymentRefundEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> findHistory(UUID userId) {
        return paymentRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> findCompletedBetween(UUID userId, CurrencyCode currency, Instant from, Instant to) {
        return paymentRepository.findCompletedBetween(userId, currency, from, to).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long sumRefundedBetween(UUID userId, CurrencyCode currency, Instant from, Instant to) {
        Long refunded = paymentRepository.sumRefundedBetween(userId, currency, from, to);
        return refunded != null ? refunded : 0L;
    }
}
