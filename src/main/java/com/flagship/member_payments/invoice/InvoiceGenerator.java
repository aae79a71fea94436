package com.flagship.member_payments.invoice;

import com.flagship.member_payments.activity.ActivityLogService;
import com.flagship.member_payments.activity.ActivityType;
import com.flagship.member_payments.document.DocumentGenerator;
import com.flagship.member_payments.document.DocumentSequenceAllocator;
import com.flagship.member_payments.document.DocumentStore;
import com.flagship.member_payments.document.GenerationJob;
import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.GenerationResult;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.member.MemberDirectory;
import com.flagship.member_payments.member.MemberProfile;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentPersistenceService;
import com.flagship.member_payments.payment.PaymentStatus;
import com.flagship.member_payments.tax.TaxBreakdown;
import com.flagship.member_payments.tax.TaxCalculationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Generates the invoice for a completed payment.
 *
 * Steps, each safe to repeat on a retried job:
 * 1. an ISSUED invoice for the payment short-circuits the job
 * 2. a PAID invoice left by an earlier attempt is reused as is
 * 3. otherwise the job's reserved number is used (allocated on first attempt)
 *    and a PAID invoice is written with its tax lines
 * 4. the document is rendered, stored, and the invoice moves to ISSUED
 */
@Component
@Slf4j
public class InvoiceGenerator implements DocumentGenerator {

    static final String CONTENT_TYPE = "text/html";

    private final PaymentPersistenceService paymentPersistenceService;
    private final InvoiceService invoiceService;
    private final GenerationQueueService queueService;
    private final MemberDirectory memberDirectory;
    private final TaxCalculationStrategy taxStrategy;
    private final InvoiceRenderer renderer;
    private final DocumentStore documentStore;
    private final ActivityLogService activityLogService;
    private final Clock clock;
    private final String sellerStateCode;

    public InvoiceGenerator(PaymentPersistenceService paymentPersistenceService,
                            InvoiceService invoiceService,
                            GenerationQueueService queueService,
                            MemberDirectory memberDirectory,
                            TaxCalculationStrategy taxStrategy,
                            InvoiceRenderer renderer,
                            DocumentStore documentStore,
                            ActivityLogService activityLogService,
                            Clock clock,
                            @Value("${documents.seller.state-code:27}") String sellerStateCode) {
        this.paymentPersistenceService = paymentPersistenceService;
        this.invoiceService = invoiceService;
        this.queueService = queueService;
        this.memberDirectory = memberDirectory;
        this.taxStrategy = taxStrategy;
        this.renderer = renderer;
        this.documentStore = documentStore;
        this.activityLogService = activityLogService;
        this.clock = clock;
        this.sellerStateCode = sellerStateCode;
    }

    @Override
    public JobKind kind() {
        return JobKind.INVOICE;
    }

    @Override
    public GenerationResult generate(GenerationJob job) {
        Payment payment = paymentPersistenceService.findById(job.getSubjectId())
            .orElseThrow(() -> new IllegalStateException("Payment not found: " + job.getSubjectId()));
        if (payment.getStatus() != PaymentStatus.COMPLETED && payment.getStatus() != PaymentStatus.REFUNDED) {
            throw new IllegalStateException(
                String.format("Cannot invoice payment %s in %s status", payment.getId(), payment.getStatus()));
        }

        Optional<Invoice> existing = invoiceService.findByPaymentId(payment.getId());
        if (existing.isPresent() && existing.get().isIssued()) {
            log.info("Invoice {} already issued for payment {}", existing.get().getInvoiceNumber(), payment.getId());
            return new GenerationResult(existing.get().getInvoiceNumber(), existing.get().getDocumentUrl());
        }

        MemberProfile member = memberDirectory.findMember(payment.getUserId()).orElse(null);
        Invoice invoice = existing.orElseGet(() -> createInvoice(job, payment, member));

        byte[] document = renderer.render(invoice, payment, member);
        String url = documentStore.store(invoice.getInvoiceNumber() + ".html", document, CONTENT_TYPE);
        Invoice issued = invoiceService.issue(invoice.getId(), url);
        return new GenerationResult(issued.getInvoiceNumber(), issued.getDocumentUrl());
    }

    @Override
    public void onPermanentFailure(GenerationJob job) {
        paymentPersistenceService.findById(job.getSubjectId()).ifPresent(payment ->
            activityLogService.record(payment.getUserId(), ActivityType.INVOICE_GENERATION_FAILED,
                "Payment", payment.getId(),
                String.format("Invoice generation failed after %d attempts: %s",
                    job.getAttempts(), job.getLastError())));
    }

    private Invoice createInvoice(GenerationJob job, Payment payment, MemberProfile member) {
        String number = queueService.reserveDocumentNumber(job.getId(), DocumentSequenceAllocator.INVOICE_PREFIX);
        boolean interstate = member != null
            && member.getStateCode() != null
            && !member.getStateCode().equals(sellerStateCode);
        TaxBreakdown tax = taxStrategy.breakdown(payment.getAmount(), interstate);
        return invoiceService.createPaid(Invoice.paid(number, payment, tax, clock.instant()));
    }
}
