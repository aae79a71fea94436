package com.flagship.member_payments.activity;

import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentGateway;
import com.flagship.member_payments.payment.PaymentService;
import com.flagship.member_payments.payment.PaymentType;
import com.flagship.member_payments.support.TestMembers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Member activity timeline and the plain health endpoint.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class ActivityControllerTest {

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
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PaymentService paymentService;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Payment transitions appear on the timeline and filter by type")
    void testTimeline() throws Exception {
        printTestHeader("Activity Timeline");
        UUID userId = TestMembers.insert(jdbcTemplate);
        Payment payment = paymentService.createOrder(userId, 250000, "INR", PaymentType.MEMBERSHIP_FEE,
                PaymentGateway.RAZORPAY, "Annual membership 2026", null).getPayment();
        paymentService.verify(payment.getGatewayOrderId(), "pay_timeline", "mock_signature_valid",
                PaymentGateway.RAZORPAY);

        mockMvc.perform(get("/api/activity").header("X-User-Id", userId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/api/activity")
                        .header("X-User-Id", userId.toString())
                        .param("type", "PAYMENT_COMPLETED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].entityId").value(payment.getId().toString()));

        mockMvc.perform(get("/api/activity")
                        .header("X-User-Id", userId.toString())
                        .param("type", "NOT_A_TYPE"))
                .andExpect(status().isBadRequest());

        printSuccess("Timeline recorded and filtered");
    }

    @Test
    @DisplayName("Timeline export is CSV with one row per entry")
    void testExport() throws Exception {
        printTestHeader("Activity Export");
        UUID userId = TestMembers.insert(jdbcTemplate);
        Payment payment = paymentService.createOrder(userId, 120000, "INR", PaymentType.SUBSCRIPTION,
                PaymentGateway.RAZORPAY, null, null).getPayment();

        MvcResult result = mockMvc.perform(get("/api/activity/export").header("X-User-Id", userId.toString()))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andReturn();

        String[] lines = result.getResponse().getContentAsString().split("\n");
        assertEquals("Date,Type,Description,Time,Entity Type,Entity ID", lines[0]);
        assertEquals(2, lines.length);
        assertTrue(lines[1].contains("\"PAYMENT_CREATED\""));
        assertTrue(lines[1].endsWith("\"Payment\",\"" + payment.getId() + "\""));

        printSuccess("Timeline exported");
    }

    @Test
    @DisplayName("Health reports the database and a queue summary")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.database").value("UP"))
                .andExpect(jsonPath("$.generationQueue.pendingJobs").exists());
    }
}
