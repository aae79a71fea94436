package com.flagship.member_payments.notification;

import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.event.InvoiceIssuedEvent;
import com.flagship.member_payments.event.PaymentCompletedEvent;
import com.flagship.member_payments.event.PaymentCreatedEvent;
import com.flagship.member_payments.event.PaymentFailedEvent;
import com.flagship.member_payments.event.RefundProcessedEvent;
import com.flagship.member_payments.event.StatementGeneratedEvent;
import com.flagship.member_payments.member.MemberDirectory;
import com.flagship.member_payments.member.MemberProfile;
import com.flagship.member_payments.payment.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns payment and document events into member emails.
 *
 * Called by the event consumer after its idempotency check, so each event is
 * handled once per consumer group; the dispatcher never throws, so a mail
 * failure does not make the event redeliver.
 */
@Service
@Slf4j
public class NotificationEventHandler {

    static final DateTimeFormatter DATE_TIME =
        DateTimeFormatter.ofPattern("dd MMM yyyy, hh:mm a", Locale.ENGLISH);
    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    private final NotificationDispatcher dispatcher;
    private final MemberDirectory memberDirectory;
    private final MoneyFormatter moneyFormatter;
    private final ZoneId zone;
    private final String paymentLinkBaseUrl;
    private final int refundExpectedDays;

    public NotificationEventHandler(NotificationDispatcher dispatcher,
                                    MemberDirectory memberDirectory,
                                    MoneyFormatter moneyFormatter,
                                    @Value("${documents.numbering.zone:Asia/Kolkata}") String zone,
                                    @Value("${payments.retry-link-base-url:http://localhost:8080/payments/retry/}")
                                    String paymentLinkBaseUrl,
                                    @Value("${notifications.refund-expected-days:7}") int refundExpectedDays) {
        this.dispatcher = dispatcher;
        this.memberDirectory = memberDirectory;
        this.moneyFormatter = moneyFormatter;
        this.zone = ZoneId.of(zone);
        this.paymentLinkBaseUrl = paymentLinkBaseUrl;
        this.refundExpectedDays = refundExpectedDays;
    }

    public Optional<DispatchResult> onPaymentCreated(PaymentCreatedEvent event) {
        return member(event.getUserId()).map(member -> dispatcher.dispatch(EmailMessage.builder()
            .userId(event.getUserId())
            .recipient(member.getEmail())
            .template(EmailTemplate.PAYMENT_INITIATED)
            .put("userName", member.getFullName())
            .put("amount", money(event.getAmount(), event.getCurrency()))
            .put("orderId", event.getGatewayOrderId())
            .put("description", event.getDescription())
            .put("paymentLink", paymentLinkBaseUrl + event.getPaymentId())
            .build()));
    }

    /**
     * Sent as soon as the payment completes; the invoice link follows separately
     * in {@link #onInvoiceIssued}.
     */
    public Optional<DispatchResult> onPaymentCompleted(PaymentCompletedEvent event) {
        return member(event.getUserId()).map(member -> dispatcher.dispatch(EmailMessage.builder()
            .userId(event.getUserId())
            .recipient(member.getEmail())
            .template(EmailTemplate.PAYMENT_SUCCESS)
            .put("userName", member.getFullName())
            .put("amount", money(event.getAmount(), event.getCurrency()))
            .put("transactionId", event.getGatewayPaymentId())
            .put("paymentDate", dateTime(event.getCompletedAt()))
            .build()));
    }

    public Optional<DispatchResult> onPaymentFailed(PaymentFailedEvent event) {
        String reason = event.getFailureReason() == null || event.getFailureReason().isBlank()
            ? "Unknown error"
            : event.getFailureReason();
        return member(event.getUserId()).map(member -> dispatcher.dispatch(EmailMessage.builder()
            .userId(event.getUserId())
            .recipient(member.getEmail())
            .template(EmailTemplate.PAYMENT_FAILED)
            .put("userName", member.getFullName())
            .put("amount", money(event.getAmount(), event.getCurrency()))
            .put("orderId", event.getGatewayOrderId())
            .put("reason", reason)
            .put("retryLink", paymentLinkBaseUrl + event.getPaymentId())
            .build()));
    }

    public Optional<DispatchResult> onRefundProcessed(RefundProcessedEvent event) {
        return member(event.getUserId()).map(member -> dispatcher.dispatch(EmailMessage.builder()
            .userId(event.getUserId())
            .recipient(member.getEmail())
            .template(EmailTemplate.REFUND_PROCESSED)
            .put("userName", member.getFullName())
            .put("amount", money(event.getRefundAmount(), event.getCurrency()))
            .put("refundId", event.getGatewayRefundId() != null ? event.getGatewayRefundId() : event.getRefundId())
            .put("originalTransactionId", event.getOriginalGatewayPaymentId())
            .put("reason", event.getReason())
            .put("expectedDays", refundExpectedDays)
            .build()));
    }

    public Optional<DispatchResult> onInvoiceIssued(InvoiceIssuedEvent event) {
        return member(event.getUserId()).map(member -> dispatcher.dispatch(EmailMessage.builder()
            .userId(event.getUserId())
            .recipient(member.getEmail())
            .template(EmailTemplate.INVOICE_READY)
            .put("userName", member.getFullName())
            .put("invoiceNumber", event.getInvoiceNumber())
            .put("amount", money(event.getTotalAmount(), event.getCurrency()))
            .put("invoiceUrl", event.getDocumentUrl())
            .build()));
    }

    public Optional<DispatchResult> onStatementGenerated(StatementGeneratedEvent event) {
        return member(event.getUserId()).map(member -> dispatcher.dispatch(
            statementMessage(event.getUserId(), member.getEmail(), member.getFullName(),
                event.getStatementNumber(), event.getDateFrom(), event.getDateTo(),
                money(event.getNetInvestment(), event.getCurrency()), event.getDocumentUrl(), false)));
    }

    /**
     * The statement-ready message, shared with on-demand statement emails.
     */
    public EmailMessage statementMessage(UUID userId, String recipient, String userName, String statementNumber,
                                         LocalDate from, LocalDate to, String netInvestment, String statementUrl,
                                         boolean explicitlyRequested) {
        return EmailMessage.builder()
            .userId(userId)
            .recipient(recipient)
            .template(EmailTemplate.STATEMENT_READY)
            .put("userName", userName)
            .put("statementNumber", statementNumber)
            .put("period", DATE.format(from) + " - " + DATE.format(to))
            .put("netInvestment", netInvestment)
            .put("statementUrl", statementUrl)
            .explicitlyRequested(explicitlyRequested)
            .build();
    }

    private Optional<MemberProfile> member(UUID userId) {
        Optional<MemberProfile> member = memberDirectory.findMember(userId);
        if (member.isEmpty()) {
            log.warn("No member record for {}; skipping notification", userId);
        }
        return member;
    }

    private String money(long amount, String currency) {
        return moneyFormatter.format(amount, CurrencyCode.fromCode(currency));
    }

    private String dateTime(Instant instant) {
        return instant == null ? "" : DATE_TIME.format(instant.atZone(zone));
    }
}
