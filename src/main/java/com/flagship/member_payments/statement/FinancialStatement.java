package com.flagship.member_payments.statement;

import com.flagship.member_payments.payment.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A member's financial statement for a date range.
 *
 * Created GENERATING with totals computed at request time; the generation job
 * recomputes them, links the document and moves it to READY. Only READY
 * statements can be emailed.
 */
@Value
@Builder(toBuilder = true)
public class FinancialStatement {
    UUID id;
    String statementNumber;
    UUID userId;
    LocalDate dateFrom;
    LocalDate dateTo;
    StatementFormat format;
    StatementStatus status;
    CurrencyCode currency;
    long totalInvested;
    long totalRefunded;
    long netInvestment;
    long totalTax;
    int transactionCount;
    String documentUrl;
    List<String> emailedTo;
    Instant emailedAt;
    Instant generatedAt;
    Instant createdAt;
    Instant updatedAt;

    public static FinancialStatement generating(String statementNumber, UUID userId, LocalDate dateFrom,
                                                LocalDate dateTo, StatementFormat format, CurrencyCode currency,
                                                StatementTotals totals, Instant now) {
        if (dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("dateFrom must not be after dateTo");
        }
        return FinancialStatement.builder()
            .id(UUID.randomUUID())
            .statementNumber(statementNumber)
            .userId(userId)
            .dateFrom(dateFrom)
            .dateTo(dateTo)
            .format(format)
            .status(StatementStatus.GENERATING)
            .currency(currency)
            .totalInvested(totals.getTotalInvested())
            .totalRefunded(totals.getTotalRefunded())
            .netInvestment(totals.getNetInvestment())
            .totalTax(totals.getTotalTax())
            .transactionCount(totals.getTransactionCount())
            .emailedTo(List.of())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * @throws IllegalStateException if the statement is already READY
     */
    public FinancialStatement ready(String documentUrl, StatementTotals totals, Instant now) {
        if (status != StatementStatus.GENERATING) {
            throw new IllegalStateException(
                String.format("Cannot complete statement %s in %s status", statementNumber, status));
        }
        return toBuilder()
            .status(StatementStatus.READY)
            .totalInvested(totals.getTotalInvested())
            .totalRefunded(totals.getTotalRefunded())
            .netInvestment(totals.getNetInvestment())
            .totalTax(totals.getTotalTax())
            .transactionCount(totals.getTransactionCount())
            .documentUrl(documentUrl)
            .generatedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Records delivery to the given addresses; addresses already listed are not repeated.
     *
     * @throws IllegalStateException if the statement is not READY
     */
    public FinancialStatement emailed(List<String> recipients, Instant now) {
        requireReady();
        List<String> all = new ArrayList<>(emailedTo != null ? emailedTo : List.of());
        for (String recipient : recipients) {
            if (!all.contains(recipient)) {
                all.add(recipient);
            }
        }
        return toBuilder()
            .emailedTo(List.copyOf(all))
            .emailedAt(now)
            .updatedAt(now)
            .build();
    }

    public void requireReady() {
        if (status != StatementStatus.READY) {
            throw new IllegalStateException(
                String.format("Statement %s is still %s", statementNumber, status));
        }
    }

    public boolean isReady() {
        return status == StatementStatus.READY;
    }
}
