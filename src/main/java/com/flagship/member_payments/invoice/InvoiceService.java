package com.flagship.member_payments.invoice;

import com.flagship.member_payments.activity.ActivityLogService;
import com.flagship.member_payments.activity.ActivityType;
import com.flagship.member_payments.event.InvoiceIssuedEvent;
import com.flagship.member_payments.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Invoice persistence and the PAID -> ISSUED step.
 *
 * Issuing writes the status change, the InvoiceIssued outbox event and the
 * activity entry in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final OutboxService outboxService;
    private final ActivityLogService activityLogService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<Invoice> findByPaymentId(UUID paymentId) {
        return invoiceRepository.findByPaymentId(paymentId).map(InvoiceEntity::toDomain);
    }

    @Transactional
    public Invoice createPaid(Invoice invoice) {
        InvoiceEntity saved = invoiceRepository.saveAndFlush(InvoiceEntity.fromDomain(invoice));
        log.info("Created invoice {} for payment {}", saved.getInvoiceNumber(), saved.getPaymentId());
        return saved.toDomain();
    }

    /**
     * Links the stored document and announces the invoice. Already issued
     * invoices are returned unchanged.
     */
    @Transactional
    public Invoice issue(UUID invoiceId, String documentUrl) {
        InvoiceEntity entity = invoiceRepository.findByIdForUpdate(invoiceId)
            .orElseThrow(() -> new IllegalArgumentException("Invoice not found: " + invoiceId));
        if (entity.getStatus() == InvoiceStatus.ISSUED) {
            return entity.toDomain();
        }

        Instant now = clock.instant();
        Invoice issued = entity.toDomain().issue(documentUrl, now);
        entity.updateFromDomain(issued);
        invoiceRepository.saveAndFlush(entity);

        outboxService.saveEvent(new InvoiceIssuedEvent(
            UUID.randomUUID(),
            issued.getId(),
            issued.getPaymentId(),
            issued.getUserId(),
            issued.getInvoiceNumber(),
            issued.getTotalAmount(),
            issued.getCurrency().name(),
            documentUrl,
            now
        ));
        activityLogService.record(issued.getUserId(), ActivityType.INVOICE_ISSUED, "Invoice", issued.getId(),
            "Invoice " + issued.getInvoiceNumber() + " issued");

        log.info("Issued invoice {} for payment {}", issued.getInvoiceNumber(), issued.getPaymentId());
        return issued;
    }
}
