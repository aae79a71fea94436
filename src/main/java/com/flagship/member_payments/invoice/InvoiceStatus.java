package com.flagship.member_payments.invoice;

/**
 * PAID: row written with its number and tax lines, document not stored yet.
 * ISSUED: document stored and linked.
 */
public enum InvoiceStatus {
    PAID,
    ISSUED
}
