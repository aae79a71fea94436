package com.flagship.member_payments.invoice.dto;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A permanently failed invoice job with the payment and member it was for.
 */
@Value
public class FailedInvoiceJob {
    UUID jobId;
    UUID paymentId;
    UUID userId;
    String memberName;
    String memberEmail;
    long amount;
    String currency;
    String paymentType;
    String gatewayPaymentId;
    int attempts;
    String lastError;
    String reservedInvoiceNumber;
    Instant failedAt;
}
