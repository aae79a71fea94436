package com.flagship.member_payments.payment;

import com.flagship.member_payments.activity.ActivityLogService;
import com.flagship.member_payments.activity.ActivityType;
import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.event.PaymentCompletedEvent;
import com.flagship.member_payments.event.PaymentCreatedEvent;
import com.flagship.member_payments.event.PaymentFailedEvent;
import com.flagship.member_payments.event.RefundProcessedEvent;
import com.flagship.member_payments.exception.ResourceNotFoundException;
import com.flagship.member_payments.gateway.GatewayClient;
import com.flagship.member_payments.gateway.GatewayOrder;
import com.flagship.member_payments.gateway.GatewayRefund;
import com.flagship.member_payments.gateway.GatewayRegistry;
import com.flagship.member_payments.observability.PaymentMetrics;
import com.flagship.member_payments.outbox.OutboxService;
import com.flagship.member_payments.webhook.PaymentVerifier;
import com.flagship.member_payments.webhook.VerificationOutcome;
import com.flagship.member_payments.webhook.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Payment lifecycle: PENDING -> {COMPLETED, FAILED}, COMPLETED -> REFUNDED.
 *
 * Every transition writes the payment row, its outbox event and an activity
 * entry in one transaction; completion also enqueues the INVOICE job there, so
 * invoice and notifications follow from a committed payment and never undo it.
 *
 * Gateway order creation runs before the transaction opens. Refunds call the
 * gateway while holding the payment row lock so two refunds cannot both pass
 * the status check.
 */
@Service
@Slf4j
public class PaymentService {

    private final PaymentPersistenceService persistenceService;
    private final GatewayRegistry gatewayRegistry;
    private final PaymentVerifier verifier;
    private final GenerationQueueService queueService;
    private final OutboxService outboxService;
    private final ActivityLogService activityLogService;
    private final IdempotencyService idempotencyService;
    private final PaymentMetrics metrics;
    private final MoneyFormatter moneyFormatter;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final long minAmount;
    private final long maxAmount;

    public PaymentService(PaymentPersistenceService persistenceService,
                          GatewayRegistry gatewayRegistry,
                          PaymentVerifier verifier,
                          GenerationQueueService queueService,
                          OutboxService outboxService,
                          ActivityLogService activityLogService,
                          IdempotencyService idempotencyService,
                          PaymentMetrics metrics,
                          MoneyFormatter moneyFormatter,
                          PlatformTransactionManager transactionManager,
                          Clock clock,
                          @Value("${payments.limits.min-amount:100}") long minAmount,
                          @Value("${payments.limits.max-amount:1000000000}") long maxAmount) {
        this.persistenceService = persistenceService;
        this.gatewayRegistry = gatewayRegistry;
        this.verifier = verifier;
        this.queueService = queueService;
        this.outboxService = outboxService;
        this.activityLogService = activityLogService;
        this.idempotencyService = idempotencyService;
        this.metrics = metrics;
        this.moneyFormatter = moneyFormatter;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
    }

    /**
     * Creates a gateway order and a PENDING payment for it.
     *
     * @param idempotencyKey optional; a repeated key returns the first order
     * @throws IllegalArgumentException on invalid amount, currency or gateway
     * @throws com.flagship.member_payments.gateway.GatewayException if the gateway cannot create the order
     */
    public CreatedOrder createOrder(UUID userId, long amount, String currencyCode, PaymentType type,
                                    PaymentGateway gateway, String description, String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<CreatedOrder> replay = replay(idempotencyKey);
            if (replay.isPresent()) {
                metrics.recordIdempotencyHit();
                return replay.get();
            }
            metrics.recordIdempotencyMiss();
        }

        if (userId == null) {
            throw new IllegalArgumentException("User id is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Payment type is required");
        }
        validateAmount(amount);
        CurrencyCode currency = CurrencyCode.fromCode(currencyCode);
        if (gateway == null || !gatewayRegistry.supports(gateway)) {
            throw new IllegalArgumentException("Payment gateway " + gateway + " is not supported");
        }
        GatewayClient client = gatewayRegistry.forGateway(gateway);

        UUID paymentId = UUID.randomUUID();
        GatewayOrder order = client.createOrder(amount, currency, paymentId.toString());

        Payment created;
        try {
            created = transactionTemplate.execute(status -> {
                Payment saved = persistenceService.save(
                    Payment.pending(paymentId, userId, amount, currency, type, gateway,
                        order.getOrderId(), description, clock.instant()),
                    idempotencyKey);
                outboxService.saveEvent(PaymentCreatedEvent.fromPayment(saved));
                activityLogService.record(userId, ActivityType.PAYMENT_CREATED, "Payment", saved.getId(),
                    String.format("%s payment of %s initiated", type.getLabel(),
                        moneyFormatter.format(amount, currency)));
                return saved;
            });
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null) {
                throw e;
            }
            log.info("Concurrent request with idempotency key {} won; returning its order", idempotencyKey);
            return replay(idempotencyKey).orElseThrow(() -> e);
        }

        if (idempotencyKey != null) {
            idempotencyService.remember(idempotencyKey, created.getId());
        }
        metrics.recordPaymentCreated(currency.name(), type.name());
        log.info("Created payment {} for order {}: {} {}", created.getId(), order.getOrderId(), amount, currency);
        return new CreatedOrder(created, client.publicKeyId(), false);
    }

    /**
     * Browser callback confirmation: checks the checkout signature and completes
     * the payment when it is valid.
     */
    public VerificationResult verify(String orderId, String gatewayPaymentId, String signature,
                                     PaymentGateway gateway) {
        GatewayClient client = gatewayRegistry.forGateway(gateway);
        boolean signatureValid = client.verifyPaymentSignature(orderId, gatewayPaymentId, signature);
        return confirm(orderId, gatewayPaymentId, signatureValid);
    }

    /**
     * Confirmation from a webhook whose body signature was already checked.
     */
    public VerificationResult confirmFromWebhook(String orderId, String gatewayPaymentId) {
        return confirm(orderId, gatewayPaymentId, true);
    }

    private VerificationResult confirm(String orderId, String gatewayPaymentId, boolean signatureValid) {
        VerificationResult result = transactionTemplate.execute(status -> {
            Optional<Payment> locked = orderId == null
                ? Optional.empty()
                : persistenceService.lockByGatewayOrderId(orderId);
            VerificationOutcome outcome = verifier.classify(locked.orElse(null), signatureValid, gatewayPaymentId);

            switch (outcome) {
                case ORDER_NOT_FOUND:
                    return VerificationResult.orderNotFound(orderId);
                case SIGNATURE_INVALID:
                    Payment payment = locked.get();
                    if (payment.getStatus() == PaymentStatus.PENDING) {
                        payment = failLocked(payment, "Payment signature verification failed",
                            "signature_invalid");
                    }
                    return VerificationResult.of(outcome, payment, "Invalid payment signature");
                case ALREADY_VERIFIED:
                    return VerificationResult.of(outcome, locked.get(), "Payment already verified");
                case INVALID_STATE:
                    return VerificationResult.of(outcome, locked.get(), String.format(
                        "Payment %s is %s", locked.get().getId(), locked.get().getStatus()));
                default:
                    return VerificationResult.of(outcome, completeLocked(locked.get(), gatewayPaymentId),
                        "Payment verified");
            }
        });

        metrics.recordVerification(result.getOutcome().name());
        log.info("Verification of order {} ({}): {}", orderId, gatewayPaymentId, result.getOutcome());
        return result;
    }

    /**
     * Fails a PENDING payment on a gateway failure notice. Payments that
     * already left PENDING are returned unchanged.
     */
    public Optional<Payment> failFromWebhook(String orderId, String reason) {
        return transactionTemplate.execute(status -> persistenceService.lockByGatewayOrderId(orderId)
            .map(payment -> payment.getStatus() == PaymentStatus.PENDING
                ? failLocked(payment, reason, "gateway_declined")
                : payment));
    }

    /**
     * Refunds a COMPLETED payment in full or in part.
     *
     * @throws ResourceNotFoundException if the payment does not exist
     * @throws IllegalStateException if the payment is not COMPLETED
     * @throws IllegalArgumentException if the amount is not in (0, payment amount]
     */
    @Transactional
    public PaymentRefund refund(UUID paymentId, long amount, String reason, String processedBy) {
        Payment payment = persistenceService.lockById(paymentId)
            .orElseThrow(() -> ResourceNotFoundException.of("Payment", paymentId));
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new IllegalStateException(String.format(
                "Cannot refund payment in %s status. Only COMPLETED payments can be refunded.",
                payment.getStatus()));
        }
        payment.validateRefundAmount(amount);

        GatewayRefund gatewayRefund = gatewayRegistry.forGateway(payment.getGateway())
            .refund(payment.getGatewayPaymentId(), amount, reason);

        Instant now = clock.instant();
        Payment refunded = persistenceService.update(payment.refund(amount, reason, now));
        PaymentRefund refund = persistenceService.saveRefund(PaymentRefund.create(
            paymentId, amount, reason, gatewayRefund.getRefundId(), processedBy, now));

        outboxService.saveEvent(RefundProcessedEvent.of(refunded, refund));
        activityLogService.record(refunded.getUserId(), ActivityType.PAYMENT_REFUNDED, "Payment", paymentId,
            String.format("Refund of %s processed", moneyFormatter.format(amount, refunded.getCurrency())));

        metrics.recordPaymentRefunded(refunded.getCurrency().name());
        log.info("Refunded {} of payment {} (gateway refund {})", amount, paymentId, gatewayRefund.getRefundId());
        return refund;
    }

    /**
     * @throws ResourceNotFoundException if the payment does not exist
     */
    public Payment get(UUID paymentId) {
        return persistenceService.findById(paymentId)
            .orElseThrow(() -> ResourceNotFoundException.of("Payment", paymentId));
    }

    public List<Payment> history(UUID userId) {
        return persistenceService.findHistory(userId);
    }

    public List<PaymentRefund> refunds(UUID paymentId) {
        return persistenceService.findRefunds(paymentId);
    }

    void validateAmount(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        if (amount < minAmount || amount > maxAmount) {
            throw new IllegalArgumentException(
                String.format("Payment amount must be between %d and %d", minAmount, maxAmount));
        }
    }

    private Optional<CreatedOrder> replay(String idempotencyKey) {
        return idempotencyService.lookup(idempotencyKey)
            .flatMap(persistenceService::findById)
            .map(existing -> new CreatedOrder(existing,
                gatewayRegistry.supports(existing.getGateway())
                    ? gatewayRegistry.forGateway(existing.getGateway()).publicKeyId()
                    : null,
                true));
    }

    private Payment completeLocked(Payment payment, String gatewayPaymentId) {
        Payment completed = persistenceService.update(payment.complete(gatewayPaymentId, clock.instant()));
        queueService.enqueue(JobKind.INVOICE, completed.getId());
        outboxService.saveEvent(PaymentCompletedEvent.fromPayment(completed));
        activityLogService.record(completed.getUserId(), ActivityType.PAYMENT_COMPLETED, "Payment",
            completed.getId(), String.format("Payment of %s completed",
                moneyFormatter.format(completed.getAmount(), completed.getCurrency())));
        metrics.recordPaymentCompleted(completed.getCurrency().name());
        return completed;
    }

    private Payment failLocked(Payment payment, String reason, String metricReason) {
        Payment failed = persistenceService.update(payment.fail(reason, clock.instant()));
        outboxService.saveEvent(PaymentFailedEvent.fromPayment(failed));
        activityLogService.record(failed.getUserId(), ActivityType.PAYMENT_FAILED, "Payment", failed.getId(),
            "Payment failed: " + reason);
        metrics.recordPaymentFailed(metricReason);
        return failed;
    }
}
