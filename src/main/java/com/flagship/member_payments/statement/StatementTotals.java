package com.flagship.member_payments.statement;

import lombok.Value;

import java.util.List;

/**
 * Aggregates over a member's completed payments in a date range.
 *
 * {@code netInvestment == totalInvested - totalTax}; refunds are reported
 * alongside but do not reduce the net.
 */
@Value
public class StatementTotals {
    long totalInvested;
    long totalRefunded;
    long totalTax;
    long netInvestment;
    int transactionCount;
    List<StatementLine> lines;
}
