package com.flagship.member_payments.payment;

/**
 * Lifecycle status of a member payment.
 *
 * Allowed transitions:
 * - PENDING → COMPLETED (verified gateway confirmation)
 * - PENDING → FAILED (signature mismatch or gateway-reported failure)
 * - COMPLETED → REFUNDED (admin refund)
 */
public enum PaymentStatus {
    /**
     * Order created at the gateway, awaiting confirmation.
     */
    PENDING,

    /**
     * Gateway confirmation verified. Carries the gateway payment reference.
     */
    COMPLETED,

    /**
     * Confirmation rejected. Terminal.
     */
    FAILED,

    /**
     * Money returned to the member. Terminal.
     */
    REFUNDED
}
