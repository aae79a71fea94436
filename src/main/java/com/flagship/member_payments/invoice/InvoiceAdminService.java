package com.flagship.member_payments.invoice;

import com.flagship.member_payments.document.GenerationJob;
import com.flagship.member_payments.document.GenerationQueueService;
import com.flagship.member_payments.document.JobKind;
import com.flagship.member_payments.document.QueueMetrics;
import com.flagship.member_payments.exception.ResourceNotFoundException;
import com.flagship.member_payments.invoice.dto.FailedInvoiceJob;
import com.flagship.member_payments.invoice.dto.RetryBatchResult;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentPersistenceService;
import com.flagship.member_payments.payment.PaymentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Operator actions on invoice generation: failed-job list, retries and queue counts.
 */
@Service
@Slf4j
public class InvoiceAdminService {

    static final int MAX_BATCH_SIZE = 50;

    private static final RowMapper<FailedInvoiceJob> FAILED_JOB_MAPPER = (rs, rowNum) -> new FailedInvoiceJob(
        rs.getObject("job_id", UUID.class),
        rs.getObject("payment_id", UUID.class),
        rs.getObject("user_id", UUID.class),
        rs.getString("full_name"),
        rs.getString("email"),
        rs.getLong("amount"),
        rs.getString("currency"),
        rs.getString("type"),
        rs.getString("gateway_payment_id"),
        rs.getInt("attempts"),
        rs.getString("last_error"),
        rs.getString("document_number"),
        rs.getTimestamp("updated_at").toInstant()
    );

    private final GenerationQueueService queueService;
    private final InvoiceService invoiceService;
    private final PaymentPersistenceService paymentPersistenceService;
    private final JdbcTemplate jdbcTemplate;

    public InvoiceAdminService(GenerationQueueService queueService,
                               InvoiceService invoiceService,
                               PaymentPersistenceService paymentPersistenceService,
                               JdbcTemplate jdbcTemplate) {
        this.queueService = queueService;
        this.invoiceService = invoiceService;
        this.paymentPersistenceService = paymentPersistenceService;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Failed invoice jobs, most recent first, joined with payment and member details.
     */
    @Transactional(readOnly = true)
    public List<FailedInvoiceJob> findFailed() {
        return jdbcTemplate.query(
            "SELECT j.id AS job_id, j.subject_id AS payment_id, p.user_id, m.full_name, m.email, " +
            "p.amount, p.currency, p.type, p.gateway_payment_id, j.attempts, j.last_error, " +
            "j.document_number, j.updated_at " +
            "FROM generation_jobs j " +
            "JOIN payments p ON p.id = j.subject_id " +
            "LEFT JOIN members m ON m.id = p.user_id " +
            "WHERE j.kind = 'INVOICE' AND j.status = 'FAILED' " +
            "ORDER BY j.updated_at DESC",
            FAILED_JOB_MAPPER
        );
    }

    /**
     * Puts invoice generation for a payment back on the queue.
     *
     * @throws ResourceNotFoundException if the payment does not exist
     * @throws IllegalStateException if the payment is not invoiceable or already has an issued invoice
     */
    @Transactional
    public GenerationJob retry(UUID paymentId) {
        Payment payment = paymentPersistenceService.findById(paymentId)
            .orElseThrow(() -> ResourceNotFoundException.of("Payment", paymentId));
        if (payment.getStatus() != PaymentStatus.COMPLETED && payment.getStatus() != PaymentStatus.REFUNDED) {
            throw new IllegalStateException(
                String.format("Payment %s is %s; only completed payments are invoiced", paymentId, payment.getStatus()));
        }
        invoiceService.findByPaymentId(paymentId)
            .filter(Invoice::isIssued)
            .ifPresent(invoice -> {
                throw new IllegalStateException(
                    "Invoice " + invoice.getInvoiceNumber() + " already issued for payment " + paymentId);
            });

        GenerationJob job = queueService.retry(JobKind.INVOICE, paymentId);
        log.info("Invoice retry for payment {}: job {} is {}", paymentId, job.getId(), job.getStatus());
        return job;
    }

    /**
     * Retries each payment independently; one failure does not stop the rest.
     */
    public RetryBatchResult retryBatch(List<UUID> paymentIds) {
        if (paymentIds == null || paymentIds.isEmpty()) {
            throw new IllegalArgumentException("paymentIds must not be empty");
        }
        if (paymentIds.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                "At most " + MAX_BATCH_SIZE + " payments can be retried at once, got " + paymentIds.size());
        }

        List<UUID> succeeded = new ArrayList<>();
        List<RetryBatchResult.Failure> failed = new ArrayList<>();
        for (UUID paymentId : paymentIds) {
            try {
                retry(paymentId);
                succeeded.add(paymentId);
            } catch (RuntimeException e) {
                log.warn("Batch invoice retry failed for payment {}: {}", paymentId, e.getMessage());
                failed.add(new RetryBatchResult.Failure(paymentId, e.getMessage()));
            }
        }
        log.info("Batch invoice retry: {} succeeded, {} failed", succeeded.size(), failed.size());
        return new RetryBatchResult(succeeded, failed);
    }

    public QueueMetrics queueMetrics() {
        return queueService.metrics(JobKind.INVOICE);
    }
}
