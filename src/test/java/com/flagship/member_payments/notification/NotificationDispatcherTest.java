package com.flagship.member_payments.notification;

import com.flagship.member_payments.member.MemberDirectory;
import com.flagship.member_payments.member.NotificationPreferences;
import com.flagship.member_payments.observability.NotificationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private MemberDirectory memberDirectory;

    @Mock
    private EmailProvider emailProvider;

    @Mock
    private EmailLogService emailLogService;

    private SimpleMeterRegistry meterRegistry;
    private NotificationDispatcher dispatcher;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new NotificationDispatcher(
                memberDirectory,
                new TemplateRenderer("https://members.example.org/settings", "support@example.org"),
                emailProvider,
                emailLogService,
                new NotificationMetrics(meterRegistry));

        lenient().when(emailProvider.name()).thenReturn("smtp");
        lenient().when(emailLogService.createPending(any(), anyString(), anyString(), anyString(), anyString()))
                .thenAnswer(invocation -> EmailLog.pending(invocation.getArgument(0), invocation.getArgument(1),
                        invocation.getArgument(2), invocation.getArgument(3), invocation.getArgument(4),
                        Instant.now()));
    }

    private EmailMessage refundMessage(boolean explicitlyRequested) {
        return EmailMessage.builder()
                .userId(userId)
                .recipient("asha@members.example.org")
                .template(EmailTemplate.REFUND_PROCESSED)
                .put("userName", "Asha")
                .put("amount", "₹500.00")
                .put("refundId", "rfnd_mock_1")
                .put("reason", "Duplicate charge")
                .put("expectedDays", 7)
                .explicitlyRequested(explicitlyRequested)
                .build();
    }

    private double counter(String template, String result) {
        return meterRegistry.counter("notifications.dispatched", "template", template, "result", result).count();
    }

    @Test
    @DisplayName("Provider accepts: EmailLog marked SENT with the provider message id")
    void sent() {
        when(memberDirectory.preferencesFor(userId)).thenReturn(NotificationPreferences.defaults());
        when(emailProvider.send(eq("asha@members.example.org"), anyString(), anyString(), anyString()))
                .thenReturn("<msg-1@smtp>");

        DispatchResult result = dispatcher.dispatch(refundMessage(false));

        assertEquals(DispatchResult.Status.SENT, result.getStatus());
        assertNotNull(result.getEmailLogId());
        verify(emailLogService).createPending(eq(userId), eq("asha@members.example.org"),
                eq("Refund Processed - India Angel Forum"), eq("refund-processed"), eq("smtp"));
        verify(emailLogService).markSent(result.getEmailLogId(), "<msg-1@smtp>");
        assertEquals(1.0, counter("refund-processed", "sent"));
    }

    @Test
    @DisplayName("Rendered body carries the model values")
    void renderedBody() {
        when(memberDirectory.preferencesFor(userId)).thenReturn(NotificationPreferences.defaults());

        dispatcher.dispatch(refundMessage(false));

        ArgumentCaptor<String> html = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(emailProvider).send(anyString(), anyString(), html.capture(), text.capture());
        assertTrue(html.getValue().contains("rfnd_mock_1"));
        assertTrue(html.getValue().contains("Duplicate charge"));
        assertTrue(text.getValue().contains("Duplicate charge"));
    }

    @Test
    @DisplayName("Opted-out member: suppressed with no EmailLog row")
    void suppressed() {
        when(memberDirectory.preferencesFor(userId)).thenReturn(new NotificationPreferences(true, false, true));

        DispatchResult result = dispatcher.dispatch(refundMessage(false));

        assertEquals(DispatchResult.Status.SUPPRESSED, result.getStatus());
        assertNull(result.getEmailLogId());
        verifyNoInteractions(emailLogService);
        verify(emailProvider, never()).send(anyString(), anyString(), anyString(), anyString());
        assertEquals(1.0, counter("refund-processed", "suppressed"));
    }

    @Test
    @DisplayName("Master switch off suppresses every member category")
    void masterSwitchOff() {
        when(memberDirectory.preferencesFor(userId)).thenReturn(new NotificationPreferences(false, true, true));

        assertEquals(DispatchResult.Status.SUPPRESSED, dispatcher.dispatch(refundMessage(false)).getStatus());
    }

    @Test
    @DisplayName("Explicit request bypasses preferences")
    void explicitBypassesPreferences() {
        DispatchResult result = dispatcher.dispatch(refundMessage(true));

        assertEquals(DispatchResult.Status.SENT, result.getStatus());
        verifyNoInteractions(memberDirectory);
    }

    @Test
    @DisplayName("Provider error: EmailLog marked FAILED and nothing thrown")
    void providerFailure() {
        when(memberDirectory.preferencesFor(userId)).thenReturn(NotificationPreferences.defaults());
        when(emailProvider.send(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new EmailSendException(SmtpEmailProvider.NOT_CONFIGURED));

        DispatchResult result = dispatcher.dispatch(refundMessage(false));

        assertEquals(DispatchResult.Status.FAILED, result.getStatus());
        assertEquals(SmtpEmailProvider.NOT_CONFIGURED, result.getError());
        verify(emailLogService).markFailed(result.getEmailLogId(), SmtpEmailProvider.NOT_CONFIGURED);
        verify(emailLogService, never()).markSent(any(), any());
        assertEquals(1.0, counter("refund-processed", "failed"));
    }

    @Test
    @DisplayName("System mail ignores preferences and has no member")
    void systemMail() {
        EmailMessage digest = EmailMessage.builder()
                .recipient("ops@example.org")
                .template(EmailTemplate.ADMIN_DIGEST)
                .put("date", "2026-10-18")
                .put("failedInvoices", 2)
                .build();

        DispatchResult result = dispatcher.dispatch(digest);

        assertEquals(DispatchResult.Status.SENT, result.getStatus());
        verify(emailProvider).send(eq("ops@example.org"), eq("Daily Admin Digest - 2026-10-18 - India Angel Forum"),
                anyString(), anyString());
        verifyNoInteractions(memberDirectory);
    }

    @Test
    @DisplayName("Log write failure is reported, not thrown")
    void logFailure() {
        when(memberDirectory.preferencesFor(userId)).thenReturn(NotificationPreferences.defaults());
        when(emailLogService.createPending(any(), anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("database unavailable"));

        DispatchResult result = dispatcher.dispatch(refundMessage(false));

        assertEquals(DispatchResult.Status.FAILED, result.getStatus());
        assertNull(result.getEmailLogId());
        verify(emailProvider, never()).send(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Missing template: EmailLog row is written and marked FAILED")
    void missingTemplateFailsLoggedRow() {
        TemplateRenderer brokenRenderer = mock(TemplateRenderer.class);
        when(brokenRenderer.subject(eq(EmailTemplate.PAYMENT_SUCCESS), any()))
                .thenReturn("Payment Successful - India Angel Forum");
        when(brokenRenderer.render(eq(EmailTemplate.PAYMENT_SUCCESS), any()))
                .thenThrow(new IllegalStateException("Email template 'payment-success' not found"));
        when(memberDirectory.preferencesFor(userId)).thenReturn(NotificationPreferences.defaults());
        NotificationDispatcher withBrokenTemplates = new NotificationDispatcher(memberDirectory, brokenRenderer,
                emailProvider, emailLogService, new NotificationMetrics(meterRegistry));

        DispatchResult result = withBrokenTemplates.dispatch(EmailMessage.builder()
                .userId(userId)
                .recipient("asha@members.example.org")
                .template(EmailTemplate.PAYMENT_SUCCESS)
                .put("userName", "Asha")
                .build());

        assertEquals(DispatchResult.Status.FAILED, result.getStatus());
        assertNotNull(result.getEmailLogId());
        verify(emailLogService).createPending(eq(userId), eq("asha@members.example.org"),
                eq("Payment Successful - India Angel Forum"), eq("payment-success"), eq("smtp"));
        verify(emailLogService).markFailed(result.getEmailLogId(), "Email template 'payment-success' not found");
        verify(emailProvider, never()).send(anyString(), anyString(), anyString(), anyString());
        assertEquals(1.0, counter("payment-success", "failed"));
    }
}
