package com.flagship.member_payments.webhook;

import com.flagship.member_payments.payment.CurrencyCode;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentGateway;
import com.flagship.member_payments.payment.PaymentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentVerifierTest {

    private static final Instant NOW = Instant.parse("2026-03-10T08:30:00Z");

    private final PaymentVerifier verifier = new PaymentVerifier();

    private Payment pending() {
        return Payment.pending(UUID.randomUUID(), UUID.randomUUID(), 250000, CurrencyCode.INR,
            PaymentType.EVENT_REGISTRATION, PaymentGateway.RAZORPAY, "order_1", null, NOW);
    }

    @Test
    @DisplayName("Unknown order is reported before the signature is considered")
    void unknownOrder() {
        assertEquals(VerificationOutcome.ORDER_NOT_FOUND, verifier.classify(null, false, "pay_1"));
        assertEquals(VerificationOutcome.ORDER_NOT_FOUND, verifier.classify(null, true, "pay_1"));
    }

    @Test
    @DisplayName("Bad signature wins over every payment state")
    void badSignature() {
        Payment completed = pending().complete("pay_1", NOW);

        assertEquals(VerificationOutcome.SIGNATURE_INVALID, verifier.classify(pending(), false, "pay_1"));
        assertEquals(VerificationOutcome.SIGNATURE_INVALID, verifier.classify(completed, false, "pay_1"));
    }

    @Test
    @DisplayName("Pending payment with valid signature is verified")
    void verified() {
        assertEquals(VerificationOutcome.VERIFIED, verifier.classify(pending(), true, "pay_1"));
    }

    @Test
    @DisplayName("Same gateway payment on a completed or refunded payment is already verified")
    void alreadyVerified() {
        Payment completed = pending().complete("pay_1", NOW);
        Payment refunded = completed.refund(1000, "Partial", NOW);

        assertEquals(VerificationOutcome.ALREADY_VERIFIED, verifier.classify(completed, true, "pay_1"));
        assertEquals(VerificationOutcome.ALREADY_VERIFIED, verifier.classify(refunded, true, "pay_1"));
    }

    @Test
    @DisplayName("A different gateway payment or a failed payment is an invalid state")
    void invalidState() {
        Payment completed = pending().complete("pay_1", NOW);
        Payment failed = pending().fail("Declined", NOW);

        assertEquals(VerificationOutcome.INVALID_STATE, verifier.classify(completed, true, "pay_2"));
        assertEquals(VerificationOutcome.INVALID_STATE, verifier.classify(failed, true, "pay_1"));
    }

    @Test
    @DisplayName("Outcomes map to HTTP statuses")
    void httpStatuses() {
        assertEquals(200, VerificationOutcome.VERIFIED.getHttpStatus());
        assertEquals(200, VerificationOutcome.ALREADY_VERIFIED.getHttpStatus());
        assertEquals(400, VerificationOutcome.SIGNATURE_INVALID.getHttpStatus());
        assertEquals(404, VerificationOutcome.ORDER_NOT_FOUND.getHttpStatus());
        assertEquals(409, VerificationOutcome.INVALID_STATE.getHttpStatus());
    }
}
