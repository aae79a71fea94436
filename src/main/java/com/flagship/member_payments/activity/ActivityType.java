package com.flagship.member_payments.activity;

public enum ActivityType {
    PAYMENT_CREATED,
    PAYMENT_COMPLETED,
    PAYMENT_FAILED,
    PAYMENT_REFUNDED,
    INVOICE_ISSUED,
    INVOICE_GENERATION_FAILED,
    STATEMENT_GENERATED,
    STATEMENT_EMAILED
}
