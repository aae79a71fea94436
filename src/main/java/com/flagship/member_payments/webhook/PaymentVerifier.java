package com.flagship.member_payments.webhook;

import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentStatus;
import org.springframework.stereotype.Component;

/**
 * Decides what an inbound confirmation means for a payment.
 *
 * Pure: the caller checks the signature and loads the payment under lock, then
 * acts on the outcome. Order of checks:
 * 1. unknown order -> ORDER_NOT_FOUND
 * 2. bad signature -> SIGNATURE_INVALID (the caller fails the payment if it is still PENDING)
 * 3. confirmed earlier with the same gateway reference -> ALREADY_VERIFIED
 * 4. any status other than PENDING -> INVALID_STATE
 * 5. otherwise VERIFIED
 */
@Component
public class PaymentVerifier {

    public VerificationOutcome classify(Payment payment, boolean signatureValid, String gatewayPaymentId) {
        if (payment == null) {
            return VerificationOutcome.ORDER_NOT_FOUND;
        }
        if (!signatureValid) {
            return VerificationOutcome.SIGNATURE_INVALID;
        }
        if (payment.isConfirmedWith(gatewayPaymentId)) {
            return VerificationOutcome.ALREADY_VERIFIED;
        }
        if (payment.getStatus() != PaymentStatus.PENDING) {
            return VerificationOutcome.INVALID_STATE;
        }
        return VerificationOutcome.VERIFIED;
    }
}
