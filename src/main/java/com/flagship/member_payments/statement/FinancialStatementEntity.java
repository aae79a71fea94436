package com.flagship.member_payments.statement;

import com.flagship.member_payments.payment.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA Entity for financial statements. The recipient list is stored as a JSONB array.
 */
@Entity
@Table(name = "financial_statements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FinancialStatementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "statement_number", nullable = false, unique = true, updatable = false, length = 32)
    private String statementNumber;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "date_from", nullable = false, updatable = false)
    private LocalDate dateFrom;

    @Column(name = "date_to", nullable = false, updatable = false)
    private LocalDate dateTo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private StatementFormat format;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private StatementStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "total_invested", nullable = false)
    private long totalInvested;

    @Column(name = "total_refunded", nullable = false)
    private long totalRefunded;

    @Column(name = "net_investment", nullable = false)
    private long netInvestment;

    @Column(name = "total_tax", nullable = false)
    private long totalTax;

    @Column(name = "transaction_count", nullable = false)
    private int transactionCount;

    @Column(name = "document_url", length = 500)
    private String documentUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "emailed_to", nullable = false, columnDefinition = "jsonb")
    private List<String> emailedTo;

    @Column(name = "emailed_at")
    private Instant emailedAt;

    @Column(name = "generated_at")
    private Instant generatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static FinancialStatementEntity fromDomain(FinancialStatement statement) {
        return new FinancialStatementEntity(
            statement.getId(),
            statement.getStatementNumber(),
            statement.getUserId(),
            statement.getDateFrom(),
            statement.getDateTo(),
            statement.getFormat(),
            statement.getStatus(),
            statement.getCurrency(),
            statement.getTotalInvested(),
            statement.getTotalRefunded(),
            statement.getNetInvestment(),
            statement.getTotalTax(),
            statement.getTransactionCount(),
            statement.getDocumentUrl(),
            new ArrayList<>(statement.getEmailedTo()),
            statement.getEmailedAt(),
            statement.getGeneratedAt(),
            statement.getCreatedAt(),
            statement.getUpdatedAt()
        );
    }

    public FinancialStatement toDomain() {
        return FinancialStatement.builder()
            .id(id)
            .statementNumber(statementNumber)
            .userId(userId)
            .dateFrom(dateFrom)
            .dateTo(dateTo)
            .format(format)
            .status(status)
            .currency(currency)
            .totalInvested(totalInvested)
            .totalRefunded(totalRefunded)
            .netInvestment(netInvestment)
            .totalTax(totalTax)
            .transactionCount(transactionCount)
            .documentUrl(documentUrl)
            .emailedTo(emailedTo != null ? List.copyOf(emailedTo) : List.of())
            .emailedAt(emailedAt)
            .generatedAt(generatedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(FinancialStatement statement) {
        this.status = statement.getStatus();
        this.totalInvested = statement.getTotalInvested();
        this.totalRefunded = statement.getTotalRefunded();
        this.netInvestment = statement.getNetInvestment();
        this.totalTax = statement.getTotalTax();
        this.transactionCount = statement.getTransactionCount();
        this.documentUrl = statement.getDocumentUrl();
        this.emailedTo = new ArrayList<>(statement.getEmailedTo());
        this.emailedAt = statement.getEmailedAt();
        this.generatedAt = statement.getGeneratedAt();
        this.updatedAt = statement.getUpdatedAt();
    }
}
