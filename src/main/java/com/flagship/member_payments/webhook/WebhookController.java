package com.flagship.member_payments.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.member_payments.gateway.GatewayClient;
import com.flagship.member_payments.gateway.GatewayRegistry;
import com.flagship.member_payments.observability.PaymentMetrics;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentGateway;
import com.flagship.member_payments.payment.PaymentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Server-to-server payment notifications.
 *
 * The body signature is checked over the raw bytes before anything is parsed;
 * a mismatch returns 400 and touches no state. Handled events:
 * - payment.captured: confirms the payment, same path as a verified checkout callback
 * - payment.failed: fails the payment if it is still PENDING
 * Anything else is acknowledged with 200 so the gateway stops redelivering it.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";
    static final String PAYMENT_CAPTURED = "payment.captured";
    static final String PAYMENT_FAILED = "payment.failed";

    private final GatewayRegistry gatewayRegistry;
    private final PaymentService paymentService;
    private final PaymentMetrics paymentMetrics;
    private final ObjectMapper objectMapper;

    @PostMapping("/{gateway}")
    public ResponseEntity<Map<String, Object>> receive(
            @PathVariable("gateway") String gatewayName,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody String rawBody) {

        PaymentGateway gateway = parseGateway(gatewayName);
        GatewayClient client = gatewayRegistry.forGateway(gateway);

        if (signature == null || !client.verifyWebhookSignature(rawBody, signature)) {
            log.warn("Rejected {} webhook with invalid signature", gateway);
            paymentMetrics.recordWebhook(gateway.name(), "invalid_signature");
            return ResponseEntity.badRequest().body(body("rejected", "Invalid webhook signature"));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook body is not valid JSON", e);
        }

        String event = root.path("event").asText("");
        JsonNode entity = root.path("payload").path("payment").path("entity");
        String orderId = textOrNull(entity, "order_id");
        String gatewayPaymentId = textOrNull(entity, "id");
        paymentMetrics.recordWebhook(gateway.name(), event.isEmpty() ? "unknown" : event);

        switch (event) {
            case PAYMENT_CAPTURED: {
                VerificationResult result = paymentService.confirmFromWebhook(orderId, gatewayPaymentId);
                log.info("Webhook {} for order {}: {}", event, orderId, result.getOutcome());
                Map<String, Object> response = body("processed", result.getMessage());
                response.put("outcome", result.getOutcome());
                return ResponseEntity.ok(response);
            }
            case PAYMENT_FAILED: {
                String reason = Optional.ofNullable(textOrNull(entity, "error_description"))
                    .orElse("Payment failed at gateway");
                Optional<Payment> payment = paymentService.failFromWebhook(orderId, reason);
                log.info("Webhook {} for order {}: {}", event, orderId,
                        payment.map(p -> p.getStatus().name()).orElse("order not found"));
                return ResponseEntity.ok(body("processed",
                    payment.isPresent() ? "Payment " + payment.get().getStatus() : "Order not found"));
            }
            default:
                log.info("Ignoring {} webhook event '{}'", gateway, event);
                return ResponseEntity.ok(body("ignored", "Event not handled"));
        }
    }

    private static PaymentGateway parseGateway(String name) {
        try {
            return PaymentGateway.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown payment gateway: " + name);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Map<String, Object> body(String status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("message", message);
        return body;
    }
}
