package com.flagship.member_payments.payment;

import com.flagship.member_payments.activity.ActivityLog;
import com.flagship.member_payments.activity.ActivityLogService;
import com.flagship.member_payments.activity.ActivityType;
import com.flagship.member_payments.document.GenerationJob;
import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.event.PaymentCompletedEvent;
import com.flagship.member_payments.event.PaymentCreatedEvent;
import com.flagship.member_payments.event.PaymentFailedEvent;
import com.flagship.member_payments.event.RefundProcessedEvent;
import com.flagship.member_payments.exception.ResourceNotFoundException;
import com.flagship.member_payments.outbox.OutboxEvent;
import com.flagship.member_payments.outbox.OutboxService;
import com.flagship.member_payments.support.TestMembers;
import com.flagship.member_payments.webhook.VerificationOutcome;
import com.flagship.member_payments.webhook.VerificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payment lifecycle against a real database.
 *
 * These tests verify that:
 * - orders are created PENDING and replayed for a repeated idempotency key
 * - verification completes a payment exactly once and queues one invoice job
 * - a bad signature fails a pending payment
 * - refunds are bounded by the original amount and only allowed once completed
 * - every transition writes its outbox event in the same transaction
 */
@SpringBootTest
@Testcontainers
class PaymentServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("member_payments_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka, outbox publisher and the document worker for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("documents.worker.enabled", () -> "false");
    }

    private static final String VALID_SIGNATURE = "mock_signature_valid";

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private GenerationQueueService queueService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ActivityLogService activityLogService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID userId;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        userId = TestMembers.insert(jdbcTemplate);
    }

    private Payment createPending(long amount) {
        return paymentService.createOrder(userId, amount, "INR", PaymentType.MEMBERSHIP_FEE,
            PaymentGateway.RAZORPAY, "Annual membership", null).getPayment();
    }

    private Payment createCompleted(long amount) {
        Payment pending = createPending(amount);
        String gatewayPaymentId = "pay_" + UUID.randomUUID().toString().substring(0, 12);
        return paymentService.verify(pending.getGatewayOrderId(), gatewayPaymentId, VALID_SIGNATURE,
            PaymentGateway.RAZORPAY).getPayment();
    }

    private List<String> eventTypes(UUID paymentId) {
        return outboxService.getEventsForAggregate("Payment", paymentId).stream()
            .map(OutboxEvent::getEventType)
            .toList();
    }

    @Nested
    @DisplayName("createOrder")
    class CreateOrder {

        @Test
        @DisplayName("Creates a PENDING payment with a gateway order and a PaymentCreated event")
        void createsPendingPayment() {
            printTestHeader("Create Order");
            printInput("User", userId);
            printInput("Amount", 250000);

            CreatedOrder order = paymentService.createOrder(userId, 250000, "inr", PaymentType.MEMBERSHIP_FEE,
                PaymentGateway.RAZORPAY, "Annual membership", null);
            Payment payment = order.getPayment();

            printOutput("Payment ID", payment.getId());
            printOutput("Order ID", payment.getGatewayOrderId());

            assertEquals(PaymentStatus.PENDING, payment.getStatus());
            assertEquals(250000, payment.getAmount());
            assertEquals(CurrencyCode.INR, payment.getCurrency());
            assertNotNull(payment.getGatewayOrderId());
            assertNull(payment.getGatewayPaymentId());
            assertFalse(order.isReplayed());
            assertEquals("rzp_test_mock", order.getGatewayKeyId());
            assertEquals(List.of(PaymentCreatedEvent.EVENT_TYPE), eventTypes(payment.getId()));

            List<ActivityLog> activity = activityLogService.findForEntity(payment.getId());
            assertEquals(1, activity.size());
            assertEquals(ActivityType.PAYMENT_CREATED, activity.get(0).getActivityType());
            assertTrue(activity.get(0).getDescription().contains("₹2,500.00"));
            printSuccess("Order created in PENDING status");
        }

        @Test
        @DisplayName("Same idempotency key returns the first order and creates nothing")
        void replaysIdempotencyKey() {
            printTestHeader("Create Order - Idempotent Replay");
            String key = "create-" + UUID.randomUUID();

            CreatedOrder first = paymentService.createOrder(userId, 100000, "INR", PaymentType.EVENT_REGISTRATION,
                PaymentGateway.RAZORPAY, "Demo day", key);
            CreatedOrder second = paymentService.createOrder(userId, 100000, "INR", PaymentType.EVENT_REGISTRATION,
                PaymentGateway.RAZORPAY, "Demo day", key);

            printOutput("First", first.getPayment().getId());
            printOutput("Second", second.getPayment().getId());

            assertFalse(first.isReplayed());
            assertTrue(second.isReplayed());
            assertEquals(first.getPayment().getId(), second.getPayment().getId());
            assertEquals(first.getPayment().getGatewayOrderId(), second.getPayment().getGatewayOrderId());
            assertEquals(1, paymentService.history(userId).size());
            printSuccess("Replay returned the original order");
        }

        @Test
        @DisplayName("Concurrent requests with one key create one payment")
        void concurrentIdempotencyKey() throws InterruptedException {
            printTestHeader("Create Order - Concurrent Same Key");
            String key = "create-" + UUID.randomUUID();
            int threadCount = 8;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            ConcurrentHashMap<UUID, Boolean> paymentIds = new ConcurrentHashMap<>();
            AtomicInteger errors = new AtomicInteger();

            for (int i = 0; i < threadCount; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        CreatedOrder order = paymentService.createOrder(userId, 50000, "INR",
                            PaymentType.SUBSCRIPTION, PaymentGateway.RAZORPAY, null, key);
                        paymentIds.put(order.getPayment().getId(), Boolean.TRUE);
                    } catch (Exception e) {
                        System.out.println("Unexpected error: " + e.getMessage());
                        errors.incrementAndGet();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
            startLatch.countDown();
            assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Distinct payment ids", paymentIds.size());
            assertEquals(0, errors.get());
            assertEquals(1, paymentIds.size());
            assertEquals(1, paymentService.history(userId).size());
            printSuccess("Exactly one payment created");
        }

        @Test
        @DisplayName("Amount outside limits, unknown currency or missing type are rejected")
        void validation() {
            printTestHeader("Create Order - Validation");
            printExpectedException("IllegalArgumentException", "invalid input");

            assertThrows(IllegalArgumentException.class, () -> paymentService.createOrder(userId, 0, "INR",
                PaymentType.OTHER, PaymentGateway.RAZORPAY, null, null));
            assertThrows(IllegalArgumentException.class, () -> paymentService.createOrder(userId, 99, "INR",
                PaymentType.OTHER, PaymentGateway.RAZORPAY, null, null));
            assertThrows(IllegalArgumentException.class, () -> paymentService.createOrder(userId, 1000000001L, "INR",
                PaymentType.OTHER, PaymentGateway.RAZORPAY, null, null));
            assertThrows(IllegalArgumentException.class, () -> paymentService.createOrder(userId, 10000, "XYZ",
                PaymentType.OTHER, PaymentGateway.RAZORPAY, null, null));
            assertThrows(IllegalArgumentException.class, () -> paymentService.createOrder(userId, 10000, "INR",
                null, PaymentGateway.RAZORPAY, null, null));

            assertTrue(paymentService.history(userId).isEmpty());
            printSuccess("Invalid orders rejected before anything was stored");
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("Valid signature completes the payment and queues one invoice job")
        void verifiesPayment() {
            printTestHeader("Verify Payment");
            Payment pending = createPending(300000);

            VerificationResult result = paymentService.verify(pending.getGatewayOrderId(), "pay_verify_1",
                VALID_SIGNATURE, PaymentGateway.RAZORPAY);

            printOutput("Outcome", result.getOutcome());
            printOutput("Status", result.getPayment().getStatus());

            assertEquals(VerificationOutcome.VERIFIED, result.getOutcome());
            assertEquals(PaymentStatus.COMPLETED, result.getPayment().getStatus());
            assertEquals("pay_verify_1", result.getPayment().getGatewayPaymentId());
            assertNotNull(result.getPayment().getCompletedAt());

            List<GenerationJob> jobs = queueService.findJobs(JobKind.INVOICE, pending.getId());
            assertEquals(1, jobs.size());
            assertEquals(List.of(PaymentCreatedEvent.EVENT_TYPE, PaymentCompletedEvent.EVENT_TYPE),
                eventTypes(pending.getId()));
            printSuccess("Payment completed with an invoice job queued");
        }

        @Test
        @DisplayName("Repeating a verification is a no-op that reports ALREADY_VERIFIED")
        void verifyIsIdempotent() {
            printTestHeader("Verify Payment - Idempotent");
            Payment pending = createPending(300000);

            VerificationResult first = paymentService.verify(pending.getGatewayOrderId(), "pay_twice",
                VALID_SIGNATURE, PaymentGateway.RAZORPAY);
            VerificationResult second = paymentService.verify(pending.getGatewayOrderId(), "pay_twice",
                VALID_SIGNATURE, PaymentGateway.RAZORPAY);

            assertEquals(VerificationOutcome.VERIFIED, first.getOutcome());
            assertEquals(VerificationOutcome.ALREADY_VERIFIED, second.getOutcome());
            assertTrue(second.isSuccessful());
            assertEquals(first.getPayment().getCompletedAt(), second.getPayment().getCompletedAt());
            assertEquals(1, queueService.findJobs(JobKind.INVOICE, pending.getId()).size());
            assertEquals(1, eventTypes(pending.getId()).stream()
                .filter(PaymentCompletedEvent.EVENT_TYPE::equals).count());
            printSuccess("Second verification changed nothing");
        }

        @Test
        @DisplayName("Concurrent verifications complete the payment exactly once")
        void concurrentVerify() throws InterruptedException {
            printTestHeader("Verify Payment - Concurrent");
            Payment pending = createPending(300000);
            int threadCount = 10;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            AtomicInteger verified = new AtomicInteger();
            AtomicInteger alreadyVerified = new AtomicInteger();

            for (int i = 0; i < threadCount; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        VerificationResult result = paymentService.verify(pending.getGatewayOrderId(),
                            "pay_concurrent", VALID_SIGNATURE, PaymentGateway.RAZORPAY);
                        if (result.getOutcome() == VerificationOutcome.VERIFIED) {
                            verified.incrementAndGet();
                        } else if (result.getOutcome() == VerificationOutcome.ALREADY_VERIFIED) {
                            alreadyVerified.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
            startLatch.countDown();
            assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Verified", verified.get());
            printOutput("Already verified", alreadyVerified.get());

            assertEquals(1, verified.get());
            assertEquals(threadCount - 1, alreadyVerified.get());
            assertEquals(1, queueService.findJobs(JobKind.INVOICE, pending.getId()).size());
            printSuccess("Row lock serialized the verifications");
        }

        @Test
        @DisplayName("Invalid signature fails a pending payment")
        void invalidSignature() {
            printTestHeader("Verify Payment - Invalid Signature");
            Payment pending = createPending(300000);

            VerificationResult result = paymentService.verify(pending.getGatewayOrderId(), "pay_bad",
                "forged", PaymentGateway.RAZORPAY);

            assertEquals(VerificationOutcome.SIGNATURE_INVALID, result.getOutcome());
            assertEquals(PaymentStatus.FAILED, result.getPayment().getStatus());
            assertEquals("Payment signature verification failed", result.getPayment().getFailureReason());
            assertNull(result.getPayment().getGatewayPaymentId());
            assertTrue(queueService.findJobs(JobKind.INVOICE, pending.getId()).isEmpty());
            assertTrue(eventTypes(pending.getId()).contains(PaymentFailedEvent.EVENT_TYPE));
            printSuccess("Forged confirmation failed the payment");
        }

        @Test
        @DisplayName("Invalid signature leaves a completed payment untouched")
        void invalidSignatureAfterCompletion() {
            Payment completed = createCompleted(300000);

            VerificationResult result = paymentService.verify(completed.getGatewayOrderId(),
                completed.getGatewayPaymentId(), "forged", PaymentGateway.RAZORPAY);

            assertEquals(VerificationOutcome.SIGNATURE_INVALID, result.getOutcome());
            assertEquals(PaymentStatus.COMPLETED, paymentService.get(completed.getId()).getStatus());
        }

        @Test
        @DisplayName("A different gateway payment for a completed order is INVALID_STATE")
        void conflictingGatewayPayment() {
            Payment completed = createCompleted(300000);

            VerificationResult result = paymentService.verify(completed.getGatewayOrderId(), "pay_other",
                VALID_SIGNATURE, PaymentGateway.RAZORPAY);

            assertEquals(VerificationOutcome.INVALID_STATE, result.getOutcome());
            assertEquals(completed.getGatewayPaymentId(), result.getPayment().getGatewayPaymentId());
        }

        @Test
        @DisplayName("Unknown order is ORDER_NOT_FOUND")
        void unknownOrder() {
            VerificationResult result = paymentService.verify("order_missing", "pay_x", VALID_SIGNATURE,
                PaymentGateway.RAZORPAY);

            assertEquals(VerificationOutcome.ORDER_NOT_FOUND, result.getOutcome());
            assertNull(result.getPayment());
        }

        @Test
        @DisplayName("Gateway failure notice fails pending payments only")
        void failFromWebhook() {
            Payment pending = createPending(300000);
            Payment completed = createCompleted(300000);

            Payment failed = paymentService.failFromWebhook(pending.getGatewayOrderId(), "Insufficient funds")
                .orElseThrow();
            Payment unchanged = paymentService.failFromWebhook(completed.getGatewayOrderId(), "Late notice")
                .orElseThrow();

            assertEquals(PaymentStatus.FAILED, failed.getStatus());
            assertEquals("Insufficient funds", failed.getFailureReason());
            assertEquals(PaymentStatus.COMPLETED, unchanged.getStatus());
            assertTrue(paymentService.failFromWebhook("order_missing", "x").isEmpty());
        }
    }

    @Nested
    @DisplayName("refund")
    class Refund {

        @Test
        @DisplayName("Partial refund moves the payment to REFUNDED and records the refund")
        void partialRefund() {
            printTestHeader("Refund - Partial");
            Payment completed = createCompleted(300000);

            PaymentRefund refund = paymentService.refund(completed.getId(), 100000, "Event cancelled", "admin-1");

            printOutput("Refund ID", refund.getId());
            printOutput("Gateway refund", refund.getGatewayRefundId());

            Payment refunded = paymentService.get(completed.getId());
            assertEquals(PaymentStatus.REFUNDED, refunded.getStatus());
            assertEquals(100000L, refunded.getRefundAmount());
            assertEquals(300000, refunded.getAmount());
            assertEquals(100000, refund.getAmount());
            assertEquals("admin-1", refund.getProcessedBy());
            assertNotNull(refund.getGatewayRefundId());
            assertEquals(1, paymentService.refunds(completed.getId()).size());
            assertTrue(eventTypes(completed.getId()).contains(RefundProcessedEvent.EVENT_TYPE));
            printSuccess("Refund recorded");
        }

        @Test
        @DisplayName("Refund above the paid amount is rejected and changes nothing")
        void refundAboveAmount() {
            printTestHeader("Refund - Above Amount");
            Payment completed = createCompleted(300000);
            printExpectedException("IllegalArgumentException", "refund exceeds payment amount");

            assertThrows(IllegalArgumentException.class,
                () -> paymentService.refund(completed.getId(), 300001, "Too much", null));

            assertEquals(PaymentStatus.COMPLETED, paymentService.get(completed.getId()).getStatus());
            assertTrue(paymentService.refunds(completed.getId()).isEmpty());
            printSuccess("Refund bound enforced");
        }

        @Test
        @DisplayName("Only completed payments can be refunded, once")
        void refundRequiresCompleted() {
            Payment pending = createPending(300000);
            Payment completed = createCompleted(300000);
            paymentService.refund(completed.getId(), 300000, "Full refund", null);

            assertThrows(IllegalStateException.class,
                () -> paymentService.refund(pending.getId(), 1000, "Not paid", null));
            assertThrows(IllegalStateException.class,
                () -> paymentService.refund(completed.getId(), 1000, "Second refund", null));
            assertThrows(ResourceNotFoundException.class,
                () -> paymentService.refund(UUID.randomUUID(), 1000, "Unknown", null));
        }

        @Test
        @DisplayName("Concurrent refunds of one payment: exactly one succeeds, one refund row")
        void concurrentRefund() throws InterruptedException {
            printTestHeader("Refund - Concurrent");
            Payment completed = createCompleted(300000);
            int threadCount = 8;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            AtomicInteger refunded = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            AtomicInteger unexpected = new AtomicInteger();

            for (int i = 0; i < threadCount; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        paymentService.refund(completed.getId(), 100000, "Event cancelled", "admin-1");
                        refunded.incrementAndGet();
                    } catch (IllegalStateException e) {
                        rejected.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (RuntimeException e) {
                        unexpected.incrementAndGet();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
            startLatch.countDown();
            assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Refunded", refunded.get());
            printOutput("Rejected", rejected.get());

            Integer refundRows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM payment_refunds WHERE payment_id = ?", Integer.class, completed.getId());
            assertEquals(1, refunded.get());
            assertEquals(threadCount - 1, rejected.get());
            assertEquals(0, unexpected.get());
            assertEquals(1, refundRows);
            assertEquals(100000L, paymentService.get(completed.getId()).getRefundAmount());
            assertEquals(1, eventTypes(completed.getId()).stream()
                .filter(RefundProcessedEvent.EVENT_TYPE::equals).count());
            printSuccess("Row lock let a single refund through");
        }
    }

    @Test
    @DisplayName("History lists the member's payments newest first")
    void history() {
        Payment first = createPending(10000);
        Payment second = createPending(20000);

        List<Payment> history = paymentService.history(userId);

        assertEquals(2, history.size());
        assertEquals(second.getId(), history.get(0).getId());
        assertEquals(first.getId(), history.get(1).getId());
        assertThrows(ResourceNotFoundException.class, () -> paymentService.get(UUID.randomUUID()));
    }
}
