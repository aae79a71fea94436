package com.flagship.member_payments.statement.dto;

import com.flagship.member_payments.statement.FinancialStatement;
import com.flagship.member_payments.statement.StatementFormat;
import com.flagship.member_payments.statement.StatementStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Statement as returned by the API. Amounts are minor units of {@code currency}.
 */
@Value
@Builder
public class StatementResponse {
    UUID id;
    String statementNumber;
    UUID userId;
    LocalDate dateFrom;
    LocalDate dateTo;
    StatementFormat format;
    StatementStatus status;
    String currency;
    long totalInvested;
    long totalRefunded;
    long totalTax;
    long netInvestment;
    int transactionCount;
    String documentUrl;
    List<String> emailedTo;
    Instant emailedAt;
    Instant generatedAt;
    Instant createdAt;

    public static StatementResponse from(FinancialStatement statement) {
        return StatementResponse.builder()
            .id(statement.getId())
            .statementNumber(statement.getStatementNumber())
            .userId(statement.getUserId())
            .dateFrom(statement.getDateFrom())
            .dateTo(statement.getDateTo())
            .format(statement.getFormat())
            .status(statement.getStatus())
            .currency(statement.getCurrency().name())
            .totalInvested(statement.getTotalInvested())
            .totalRefunded(statement.getTotalRefunded())
            .totalTax(statement.getTotalTax())
            .netInvestment(statement.getNetInvestment())
            .transactionCount(statement.getTransactionCount())
            .documentUrl(statement.getDocumentUrl())
            .emailedTo(statement.getEmailedTo())
            .emailedAt(statement.getEmailedAt())
            .generatedAt(statement.getGeneratedAt())
            .createdAt(statement.getCreatedAt())
            .build();
    }
}
