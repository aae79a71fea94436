package com.flagship.member_payments.invoice;

import com.flagship.member_payments.document.QueueMetrics;
import com.flagship.member_payments.invoice.dto.FailedInvoiceJob;
import com.flagship.member_payments.invoice.dto.RetryBatchRequest;
import com.flagship.member_payments.invoice.dto.RetryBatchResult;
import com.flagship.member_payments.invoice.dto.RetryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Admin endpoints for invoice generation. Role checks happen upstream.
 */
@RestController
@RequestMapping("/api/admin/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceAdminController {

    private final InvoiceAdminService invoiceAdminService;

    @GetMapping("/failed")
    public ResponseEntity<List<FailedInvoiceJob>> failed() {
        return ResponseEntity.ok(invoiceAdminService.findFailed());
    }

    @PostMapping("/{paymentId}/retry")
    public ResponseEntity<RetryResponse> retry(@PathVariable("paymentId") UUID paymentId) {
        log.info("Admin invoice retry requested for payment {}", paymentId);
        return ResponseEntity.ok(RetryResponse.from(invoiceAdminService.retry(paymentId)));
    }

    @PostMapping("/retry-batch")
    public ResponseEntity<RetryBatchResult> retryBatch(@Valid @RequestBody RetryBatchRequest request) {
        log.info("Admin batch invoice retry requested for {} payments", request.getPaymentIds().size());
        return ResponseEntity.ok(invoiceAdminService.retryBatch(request.getPaymentIds()));
    }

    @GetMapping("/queue-metrics")
    public ResponseEntity<QueueMetrics> queueMetrics() {
        return ResponseEntity.ok(invoiceAdminService.queueMetrics());
    }
}
