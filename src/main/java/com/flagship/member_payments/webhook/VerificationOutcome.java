package com.flagship.member_payments.webhook;

/**
 * Classification of an inbound payment confirmation.
 */
public enum VerificationOutcome {
    /** Signature valid and the PENDING payment was completed. */
    VERIFIED(200),
    /** Same confirmation seen before; nothing changed. */
    ALREADY_VERIFIED(200),
    SIGNATURE_INVALID(400),
    ORDER_NOT_FOUND(404),
    /** Payment is terminal with a different gateway reference. */
    INVALID_STATE(409);

    private final int httpStatus;

    VerificationOutcome(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
