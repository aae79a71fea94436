package com.flagship.member_payments.statement;

import com.flagship.member_payments.payment.PaymentType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One completed payment as it appears on a DETAILED statement.
 */
@Value
public class StatementLine {
    UUID paymentId;
    Instant completedAt;
    PaymentType type;
    String description;
    String gatewayPaymentId;
    long amount;
    long tax;
}
