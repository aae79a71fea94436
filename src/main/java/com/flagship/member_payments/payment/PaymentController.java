package com.flagship.member_payments.payment;

import com.flagship.member_payments.common.CsvWriter;
import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.observability.CorrelationContext;
import com.flagship.member_payments.observability.PaymentMetrics;
import com.flagship.member_payments.payment.dto.CreateOrderRequest;
import com.flagship.member_payments.payment.dto.CreateOrderResponse;
import com.flagship.member_payments.payment.dto.PaymentResponse;
import com.flagship.member_payments.payment.dto.RefundRequest;
import com.flagship.member_payments.payment.dto.RefundResponse;
import com.flagship.member_payments.payment.dto.VerifyPaymentRequest;
import com.flagship.member_payments.payment.dto.VerifyPaymentResponse;
import com.flagship.member_payments.webhook.VerificationResult;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * REST Controller for payment operations.
 *
 * Key features:
 * - create-order honours an optional Idempotency-Key header
 * - verify maps each verification outcome to its HTTP status
 * - history is available as JSON or CSV
 */
@RestController
@RequestMapping("/api/payments")
@Slf4j
public class PaymentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String USER_ID_HEADER = "X-User-Id";

    private final PaymentService paymentService;
    private final PaymentMetrics paymentMetrics;
    private final MoneyFormatter moneyFormatter;
    private final Clock clock;
    private final ZoneId zone;

    public PaymentController(PaymentService paymentService,
                             PaymentMetrics paymentMetrics,
                             MoneyFormatter moneyFormatter,
                             Clock clock,
                             @Value("${documents.numbering.zone:Asia/Kolkata}") String zone) {
        this.paymentService = paymentService;
        this.paymentMetrics = paymentMetrics;
        this.moneyFormatter = moneyFormatter;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    /**
     * Creates a gateway order and a PENDING payment.
     *
     * A repeated Idempotency-Key returns the original order with 200 instead of 201.
     */
    @PostMapping("/create-order")
    public ResponseEntity<CreateOrderResponse> createOrder(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateOrderRequest request) {

        long startTime = System.currentTimeMillis();
        log.info("Received create-order request: userId={}, amount={}, currency={}, type={}",
                userId, request.getAmount(), request.getCurrency(), request.getType());

        try {
            CreatedOrder order = paymentService.createOrder(userId, request.getAmount(), request.getCurrency(),
                request.getType(), request.gatewayOrDefault(), request.getDescription(), idempotencyKey);
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, order.getPayment().getId().toString());

            long duration = System.currentTimeMillis() - startTime;
            paymentMetrics.recordPaymentLatency("create", duration);

            if (order.isReplayed()) {
                log.info("Idempotency key already used, returning existing order {}",
                        order.getPayment().getGatewayOrderId());
                return ResponseEntity.ok(CreateOrderResponse.from(order));
            }
            log.info("Order {} created in {}ms", order.getPayment().getGatewayOrderId(), duration);
            return ResponseEntity.status(HttpStatus.CREATED).body(CreateOrderResponse.from(order));

        } catch (RuntimeException e) {
            paymentMetrics.recordPaymentLatency("create", System.currentTimeMillis() - startTime);
            log.warn("Order creation failed: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    /**
     * Checkout callback: VERIFIED and ALREADY_VERIFIED return 200,
     * SIGNATURE_INVALID 400, ORDER_NOT_FOUND 404, INVALID_STATE 409.
     */
    @PostMapping("/verify")
    public ResponseEntity<VerifyPaymentResponse> verify(@Valid @RequestBody VerifyPaymentRequest request) {
        long startTime = System.currentTimeMillis();

        VerificationResult result = paymentService.verify(
            request.getOrderId(), request.getPaymentId(), request.getSignature(), request.gatewayOrDefault());

        paymentMetrics.recordPaymentLatency("verify", System.currentTimeMillis() - startTime);
        return ResponseEntity.status(result.getOutcome().getHttpStatus())
            .body(VerifyPaymentResponse.from(result));
    }

    @PostMapping("/refund")
    public ResponseEntity<RefundResponse> refund(
            @RequestHeader(value = USER_ID_HEADER, required = false) String processedBy,
            @Valid @RequestBody RefundRequest request) {

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, request.getPaymentId().toString());
        try {
            log.info("Refund requested for payment {}: amount={}", request.getPaymentId(), request.getAmount());
            PaymentRefund refund = paymentService.refund(
                request.getPaymentId(), request.getAmount(), request.getReason(), processedBy);
            return ResponseEntity.ok(RefundResponse.from(refund));
        } finally {
            paymentMetrics.recordPaymentLatency("refund", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.get(id)));
    }

    /**
     * Member's payments, newest first. {@code ?format=csv} downloads them as CSV.
     */
    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestHeader(USER_ID_HEADER) UUID userId,
                                     @RequestParam(value = "format", required = false) String format) {
        List<Payment> payments = paymentService.history(userId);
        if (!"csv".equalsIgnoreCase(format)) {
            return ResponseEntity.ok(payments.stream().map(PaymentResponse::from).toList());
        }

        CsvWriter csv = CsvWriter.withHeader("Transaction ID", "Date", "Type", "Amount", "Currency", "Status",
            "Gateway", "Description", "Refund Amount");
        for (Payment payment : payments) {
            csv.row(payment.getGatewayPaymentId() != null ? payment.getGatewayPaymentId() : payment.getGatewayOrderId(),
                payment.getCreatedAt().atZone(zone).toLocalDate(),
                payment.getType().getLabel(),
                moneyFormatter.plain(payment.getAmount(), payment.getCurrency()),
                payment.getCurrency(),
                payment.getStatus(),
                payment.getGateway(),
                payment.getDescription(),
                payment.getRefundAmount() != null
                    ? moneyFormatter.plain(payment.getRefundAmount(), payment.getCurrency())
                    : "");
        }

        String filename = "transactions-" + LocalDate.now(clock.withZone(zone)) + ".csv";
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
            .contentType(MediaType.parseMediaType("text/csv"))
            .body(csv.toString());
    }
}
