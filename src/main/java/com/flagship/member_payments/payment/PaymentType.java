package com.flagship.member_payments.payment;

/**
 * What the member is paying for.
 */
public enum PaymentType {
    MEMBERSHIP_FEE("Membership Fee"),
    EVENT_REGISTRATION("Event Registration"),
    DEAL_COMMITMENT("Deal Commitment"),
    SUBSCRIPTION("Subscription"),
    OTHER("Payment");

    private final String label;

    PaymentType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
