package com.flagship.member_payments.notification;

import com.flagship.member_payments.common.MoneyFormatter;
import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.document.QueueMetrics;
import com.flagship.member_payments.invoice.InvoiceAdminService;
import com.flagship.member_payments.invoice.dto.FailedInvoiceJob;
import com.flagship.member_payments.payment.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Daily email to operations listing invoice jobs that exhausted their retries.
 *
 * Skipped when no recipient is configured or nothing has failed.
 */
@Service
@Slf4j
public class AdminDigestService {

    private static final int MAX_ROWS = 100;

    private final InvoiceAdminService invoiceAdminService;
    private final GenerationQueueService queueService;
    private final NotificationDispatcher dispatcher;
    private final MoneyFormatter moneyFormatter;
    private final Clock clock;
    private final boolean enabled;
    private final String recipient;

    public AdminDigestService(InvoiceAdminService invoiceAdminService,
                              GenerationQueueService queueService,
                              NotificationDispatcher dispatcher,
                              MoneyFormatter moneyFormatter,
                              Clock clock,
                              @Value("${notifications.admin-digest.enabled:true}") boolean enabled,
                              @Value("${notifications.admin-digest.recipient:}") String recipient) {
        this.invoiceAdminService = invoiceAdminService;
        this.queueService = queueService;
        this.dispatcher = dispatcher;
        this.moneyFormatter = moneyFormatter;
        this.clock = clock;
        this.enabled = enabled;
        this.recipient = recipient;
    }

    @Scheduled(cron = "${notifications.admin-digest.cron:0 0 9 * * *}", zone = "UTC")
    public void scheduledDigest() {
        if (!enabled) {
            return;
        }
        sendDigest();
    }

    /**
     * @return the dispatch result, or empty when there was nothing to send
     */
    public Optional<DispatchResult> sendDigest() {
        if (recipient == null || recipient.isBlank()) {
            log.debug("Admin digest recipient not configured; skipping");
            return Optional.empty();
        }

        List<FailedInvoiceJob> failed = invoiceAdminService.findFailed();
        if (failed.isEmpty()) {
            log.info("No failed invoice jobs; admin digest not sent");
            return Optional.empty();
        }

        QueueMetrics invoiceQueue = invoiceAdminService.queueMetrics();
        int failedStatements = queueService.findFailed(JobKind.STATEMENT).size();
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));

        EmailMessage message = EmailMessage.builder()
            .recipient(recipient)
            .template(EmailTemplate.ADMIN_DIGEST)
            .put("date", today.format(DateTimeFormatter.ISO_LOCAL_DATE))
            .put("failedInvoices", failed.size())
            .put("pendingJobs", invoiceQueue.getPendingJobs())
            .put("activeJobs", invoiceQueue.getActiveJobs())
            .put("completedJobs", invoiceQueue.getCompletedJobs())
            .put("failedStatements", failedStatements)
            .put("truncated", failed.size() > MAX_ROWS)
            .put("rows", rows(failed))
            .build();

        DispatchResult result = dispatcher.dispatch(message);
        log.info("Admin digest for {} with {} failed invoices: {}", today, failed.size(), result.getStatus());
        return Optional.of(result);
    }

    private String rows(List<FailedInvoiceJob> failed) {
        StringBuilder html = new StringBuilder();
        for (FailedInvoiceJob job : failed.subList(0, Math.min(failed.size(), MAX_ROWS))) {
            html.append("<tr>")
                .append(cell(job.getPaymentId().toString()))
                .append(cell(job.getMemberName() != null ? job.getMemberName() : "Unknown"))
                .append(cell(job.getMemberEmail()))
                .append(cell(moneyFormatter.format(job.getAmount(), CurrencyCode.fromCode(job.getCurrency()))))
                .append(cell(String.valueOf(job.getAttempts())))
                .append(cell(job.getLastError()))
                .append("</tr>\n");
        }
        return html.toString();
    }

    private static String cell(String value) {
        return "<td>" + HtmlUtils.htmlEscape(value == null ? "" : value) + "</td>";
    }
}
