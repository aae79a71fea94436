package com.flagship.member_payments.invoice;

import com.flagship.member_payments.document.GenerationJob;
import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.GenerationWorker;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.document.JobStatus;
import com.flagship.member_payments.event.InvoiceIssuedEvent;
import com.flagship.member_payments.outbox.OutboxEvent;
import com.flagship.member_payments.outbox.OutboxService;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentGateway;
import com.flagship.member_payments.payment.PaymentService;
import com.flagship.member_payments.payment.PaymentType;
import com.flagship.member_payments.support.TestMembers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Invoice generation end to end: verification queues the job, the worker
 * allocates the number, computes tax, stores the document and issues the invoice.
 */
@SpringBootTest
@Testcontainers
class InvoiceGenerationTest {

    private static final Path STORAGE = Path.of(System.getProperty("java.io.tmpdir"),
            "member-payments-invoices-" + UUID.randomUUID());

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
        registry.add("documents.storage.directory", STORAGE::toString);
    }

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private GenerationWorker worker;

    @Autowired
    private GenerationQueueService queueService;

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM generation_jobs WHERE status IN ('QUEUED', 'RUNNING')");
    }

    private Payment completedPayment(UUID userId, long amount) {
        Payment pending = paymentService.createOrder(userId, amount, "INR", PaymentType.MEMBERSHIP_FEE,
                PaymentGateway.RAZORPAY, "Annual membership 2026", null).getPayment();
        paymentService.verify(pending.getGatewayOrderId(), "pay_" + UUID.randomUUID().toString().substring(0, 8),
                "mock_signature_valid", PaymentGateway.RAZORPAY);
        return paymentService.get(pending.getId());
    }

    @Test
    @DisplayName("Intrastate member gets CGST and SGST; document is stored and invoice ISSUED")
    void intrastateInvoice() throws Exception {
        UUID userId = TestMembers.insert(jdbcTemplate, "Asha Mehta", TestMembers.INTRASTATE);
        Payment payment = completedPayment(userId, 300000);

        assertTrue(queueService.findInFlight(JobKind.INVOICE, payment.getId()).isPresent(),
                "Verification queued the invoice job");
        assertEquals(1, worker.runOnce());

        Invoice invoice = invoiceService.findByPaymentId(payment.getId()).orElseThrow();
        System.out.println("Invoice: " + invoice);

        assertEquals(InvoiceStatus.ISSUED, invoice.getStatus());
        assertTrue(invoice.getInvoiceNumber().matches("INV-\\d{4}-\\d{2}-\\d{5}"));
        assertEquals(300000, invoice.getTotalAmount());
        assertEquals(243000, invoice.getSubtotal());
        assertEquals(27000, invoice.getCgst());
        assertEquals(27000, invoice.getSgst());
        assertEquals(0, invoice.getIgst());
        assertEquals(3000, invoice.getTds());
        assertEquals(invoice.getTotalAmount(),
                invoice.getSubtotal() + invoice.getCgst() + invoice.getSgst() + invoice.getIgst() + invoice.getTds());

        Path document = STORAGE.resolve(invoice.getInvoiceNumber() + ".html");
        assertTrue(Files.exists(document));
        String html = Files.readString(document, StandardCharsets.UTF_8);
        assertTrue(html.contains(invoice.getInvoiceNumber()));
        assertTrue(html.contains("Asha Mehta"));
        assertTrue(invoice.getDocumentUrl().endsWith(invoice.getInvoiceNumber() + ".html"));

        GenerationJob job = queueService.findJobs(JobKind.INVOICE, payment.getId()).get(0);
        assertEquals(JobStatus.SUCCEEDED, job.getStatus());
        assertEquals(invoice.getInvoiceNumber(), job.getDocumentNumber());
        assertEquals(invoice.getDocumentUrl(), job.getResultReference());
    }

    @Test
    @DisplayName("Interstate member gets IGST")
    void interstateInvoice() {
        UUID userId = TestMembers.insert(jdbcTemplate, "Ravi Kumar", TestMembers.INTERSTATE);
        Payment payment = completedPayment(userId, 300000);

        worker.runOnce();

        Invoice invoice = invoiceService.findByPaymentId(payment.getId()).orElseThrow();
        assertEquals(54000, invoice.getIgst());
        assertEquals(0, invoice.getCgst());
        assertEquals(0, invoice.getSgst());
        assertEquals(3000, invoice.getTds());
        assertEquals(243000, invoice.getSubtotal());
    }

    @Test
    @DisplayName("Issuing writes an InvoiceIssued event in the same transaction")
    void invoiceIssuedEvent() {
        UUID userId = TestMembers.insert(jdbcTemplate);
        Payment payment = completedPayment(userId, 150000);

        worker.runOnce();

        Invoice invoice = invoiceService.findByPaymentId(payment.getId()).orElseThrow();
        List<OutboxEvent> events = outboxService.getEventsForAggregate("Invoice", invoice.getId());
        assertEquals(1, events.size());
        assertEquals(InvoiceIssuedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertTrue(events.get(0).getPayload().contains(invoice.getInvoiceNumber()));
        assertTrue(events.get(0).getPayload().contains(payment.getId().toString()));
    }

    @Test
    @DisplayName("Invoice numbers are sequential across payments")
    void sequentialNumbers() {
        UUID userId = TestMembers.insert(jdbcTemplate);
        Payment first = completedPayment(userId, 10000);
        worker.runOnce();
        Payment second = completedPayment(userId, 20000);
        worker.runOnce();

        String n1 = invoiceService.findByPaymentId(first.getId()).orElseThrow().getInvoiceNumber();
        String n2 = invoiceService.findByPaymentId(second.getId()).orElseThrow().getInvoiceNumber();
        long seq1 = Long.parseLong(n1.substring(n1.lastIndexOf('-') + 1));
        long seq2 = Long.parseLong(n2.substring(n2.lastIndexOf('-') + 1));

        assertEquals(n1.substring(0, n1.lastIndexOf('-')), n2.substring(0, n2.lastIndexOf('-')));
        assertEquals(seq1 + 1, seq2);
    }

    @Test
    @DisplayName("Rerunning an issued payment's job does not create a second invoice")
    void regenerationIsIdempotent() {
        UUID userId = TestMembers.insert(jdbcTemplate);
        Payment payment = completedPayment(userId, 50000);
        worker.runOnce();
        Invoice issued = invoiceService.findByPaymentId(payment.getId()).orElseThrow();

        // A stray second job for the same payment short-circuits
        queueService.enqueue(JobKind.INVOICE, payment.getId());
        worker.runOnce();

        Integer invoices = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM invoices WHERE payment_id = ?", Integer.class, payment.getId());
        assertEquals(1, invoices);
        List<GenerationJob> jobs = queueService.findJobs(JobKind.INVOICE, payment.getId());
        assertEquals(2, jobs.size());
        assertEquals(issued.getDocumentUrl(), jobs.get(1).getResultReference());
        assertEquals(1, outboxService.getEventsForAggregate("Invoice", issued.getId()).size());
    }
}
