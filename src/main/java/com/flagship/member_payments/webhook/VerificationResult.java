package com.flagship.member_payments.webhook;

import com.flagship.member_payments.payment.Payment;
import lombok.Value;

/**
 * Outcome of a verification plus the payment as it stands afterwards.
 * The payment is null only for ORDER_NOT_FOUND.
 */
@Value
public class VerificationResult {
    VerificationOutcome outcome;
    Payment payment;
    String message;

    public static VerificationResult of(VerificationOutcome outcome, Payment payment, String message) {
        return new VerificationResult(outcome, payment, message);
    }

    public static VerificationResult orderNotFound(String orderId) {
        return new VerificationResult(VerificationOutcome.ORDER_NOT_FOUND, null, "Order not found: " + orderId);
    }

    public boolean isSuccessful() {
        return outcome == VerificationOutcome.VERIFIED || outcome == VerificationOutcome.ALREADY_VERIFIED;
    }
}
