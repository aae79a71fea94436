package com.flagship.member_payments.webhook;

import com.flagship.member_payments.gateway.HmacSignatures;
import com.flagship.member_payments.payment.CreatedOrder;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentGateway;
import com.flagship.member_payments.payment.PaymentService;
import com.flagship.member_payments.payment.PaymentStatus;
import com.flagship.member_payments.payment.PaymentType;
import com.flagship.member_payments.support.TestMembers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Gateway webhooks: signature over the raw body, captured and failed events.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class WebhookControllerTest {

    private static final String WEBHOOK_SECRET = "mock_webhook_secret";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("member_payments_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("documents.worker.enabled", () -> "false");
        registry.add("gateway.razorpay.webhook-secret", () -> WEBHOOK_SECRET);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Payment payment;

    @BeforeEach
    void setUp() {
        UUID userId = TestMembers.insert(jdbcTemplate);
        CreatedOrder order = paymentService.createOrder(userId, 300000, "INR", PaymentType.EVENT_REGISTRATION,
            PaymentGateway.RAZORPAY, "Demo day pass", null);
        payment = order.getPayment();
    }

    private static String capturedBody(String orderId, String gatewayPaymentId) {
        return "{\"event\":\"payment.captured\",\"payload\":{\"payment\":{\"entity\":"
            + "{\"id\":\"" + gatewayPaymentId + "\",\"order_id\":\"" + orderId + "\",\"status\":\"captured\"}}}}";
    }

    private static String failedBody(String orderId) {
        return "{\"event\":\"payment.failed\",\"payload\":{\"payment\":{\"entity\":"
            + "{\"id\":\"pay_declined\",\"order_id\":\"" + orderId + "\",\"error_description\":\"Card declined\"}}}}";
    }

    @Test
    @DisplayName("Captured webhook with a valid signature completes the payment")
    void capturedCompletesPayment() throws Exception {
        String body = capturedBody(payment.getGatewayOrderId(), "pay_hook_1");

        mockMvc.perform(post("/api/webhooks/razorpay")
                        .header("X-Razorpay-Signature", HmacSignatures.hmacSha256Hex(WEBHOOK_SECRET, body))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("processed"))
                .andExpect(jsonPath("$.outcome").value("VERIFIED"));

        Payment after = paymentService.get(payment.getId());
        assertEquals(PaymentStatus.COMPLETED, after.getStatus());
        assertEquals("pay_hook_1", after.getGatewayPaymentId());

        // Gateways redeliver; the second delivery changes nothing
        mockMvc.perform(post("/api/webhooks/razorpay")
                        .header("X-Razorpay-Signature", HmacSignatures.hmacSha256Hex(WEBHOOK_SECRET, body))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("ALREADY_VERIFIED"));

        Integer jobs = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM generation_jobs WHERE subject_id = ?", Integer.class, payment.getId());
        assertEquals(1, jobs);
    }

    @Test
    @DisplayName("Invalid signature is rejected and leaves the payment untouched")
    void invalidSignatureRejected() throws Exception {
        String body = capturedBody(payment.getGatewayOrderId(), "pay_hook_2");

        mockMvc.perform(post("/api/webhooks/razorpay")
                        .header("X-Razorpay-Signature", HmacSignatures.hmacSha256Hex("wrong_secret", body))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("rejected"));

        mockMvc.perform(post("/api/webhooks/razorpay")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest());

        assertEquals(PaymentStatus.PENDING, paymentService.get(payment.getId()).getStatus());
    }

    @Test
    @DisplayName("Failed webhook fails a pending payment with the gateway's reason")
    void failedWebhookFailsPayment() throws Exception {
        String body = failedBody(payment.getGatewayOrderId());

        mockMvc.perform(post("/api/webhooks/razorpay")
                        .header("X-Razorpay-Signature", HmacSignatures.hmacSha256Hex(WEBHOOK_SECRET, body))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());

        Payment after = paymentService.get(payment.getId());
        assertEquals(PaymentStatus.FAILED, after.getStatus());
        assertEquals("Card declined", after.getFailureReason());
    }

    @Test
    @DisplayName("Unhandled events are acknowledged and ignored")
    void unknownEventIgnored() throws Exception {
        String body = "{\"event\":\"order.paid\",\"payload\":{}}";

        mockMvc.perform(post("/api/webhooks/razorpay")
                        .header("X-Razorpay-Signature", HmacSignatures.hmacSha256Hex(WEBHOOK_SECRET, body))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ignored"));

        assertEquals(PaymentStatus.PENDING, paymentService.get(payment.getId()).getStatus());
    }

    @Test
    @DisplayName("Unknown gateway in the path is a bad request")
    void unknownGateway() throws Exception {
        mockMvc.perform(post("/api/webhooks/paypal")
                        .header("X-Razorpay-Signature", "abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }
}
