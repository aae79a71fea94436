package com.flagship.member_payments.statement;

/**
 * SUMMARY carries totals only; DETAILED adds one line per payment.
 */
public enum StatementFormat {
    SUMMARY,
    DETAILED
}
