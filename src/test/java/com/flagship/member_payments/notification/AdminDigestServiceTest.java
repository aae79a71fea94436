package com.flagship.member_payments.notification;

import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.document.GenerationJob;
import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.document.QueueMetrics;
import com.flagship.member_payments.invoice.InvoiceAdminService;
import com.flagship.member_payments.invoice.dto.FailedInvoiceJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminDigestServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-18T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private InvoiceAdminService invoiceAdminService;

    @Mock
    private GenerationQueueService queueService;

    @Mock
    private NotificationDispatcher dispatcher;

    private AdminDigestService service(String recipient) {
        return new AdminDigestService(invoiceAdminService, queueService, dispatcher, new MoneyFormatter(),
            CLOCK, true, recipient);
    }

    private FailedInvoiceJob failedJob(String memberName, String lastError) {
        return new FailedInvoiceJob(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), memberName,
            "member@example.com", 250000, "INR", "MEMBERSHIP_FEE", "pay_mock_1", 3, lastError,
            "INV-2026-10-00007", Instant.parse("2026-10-17T21:00:00Z"));
    }

    @Test
    @DisplayName("No recipient configured: nothing is queried or sent")
    void skippedWithoutRecipient() {
        assertEquals(Optional.empty(), service("  ").sendDigest());
        verifyNoInteractions(invoiceAdminService, queueService, dispatcher);
    }

    @Test
    @DisplayName("No failed invoices: digest is not sent")
    void skippedWhenNothingFailed() {
        when(invoiceAdminService.findFailed()).thenReturn(List.of());

        assertEquals(Optional.empty(), service("ops@example.com").sendDigest());
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("Failed invoices are summarised with queue counts and escaped rows")
    void sendsDigest() {
        when(invoiceAdminService.findFailed())
            .thenReturn(List.of(failedJob("Neha Iyer", "Storage <unavailable>"), failedJob(null, null)));
        when(invoiceAdminService.queueMetrics()).thenReturn(new QueueMetrics(4, 1, 2, 40));
        when(queueService.findFailed(JobKind.STATEMENT)).thenReturn(List.of(GenerationJob.queued(JobKind.STATEMENT, UUID.randomUUID(), 3, CLOCK.instant())));
        when(dispatcher.dispatch(any())).thenReturn(DispatchResult.sent(UUID.randomUUID()));

        Optional<DispatchResult> result = service("ops@example.com").sendDigest();

        assertTrue(result.isPresent());
        assertEquals(DispatchResult.Status.SENT, result.get().getStatus());

        ArgumentCaptor<EmailMessage> captor = ArgumentCaptor.forClass(EmailMessage.class);
        verify(dispatcher).dispatch(captor.capture());
        EmailMessage message = captor.getValue();
        assertEquals("ops@example.com", message.getRecipient());
        assertEquals(EmailTemplate.ADMIN_DIGEST, message.getTemplate());
        assertNull(message.getUserId());
        assertEquals("2026-10-18", message.getModel().get("date"));
        assertEquals(2, message.getModel().get("failedInvoices"));
        assertEquals(4L, message.getModel().get("pendingJobs"));
        assertEquals(1, message.getModel().get("failedStatements"));
        assertEquals(false, message.getModel().get("truncated"));

        String rows = (String) message.getModel().get("rows");
        assertTrue(rows.contains("Neha Iyer"));
        assertTrue(rows.contains("Unknown"));
        assertTrue(rows.contains("Storage &lt;unavailable&gt;"));
        assertTrue(rows.contains("₹2,500.00"));
    }
}
