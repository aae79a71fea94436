package com.flagship.member_payments.document;

/**
 * What a generation job produces. The subject id is a payment id for INVOICE
 * and a financial statement id for STATEMENT.
 */
public enum JobKind {
    INVOICE,
    STATEMENT
}
