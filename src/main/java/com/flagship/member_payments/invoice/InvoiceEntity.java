package com.flagship.member_payments.invoice;

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

import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for invoices. Amount columns never change after insert; only the
 * status, document link and issue time move, through updateFromDomain().
 */
@Entity
@Table(name = "invoices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_number", nullable = false, unique = true, updatable = false, length = 32)
    private String invoiceNumber;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "payment_id", nullable = false, unique = true, updatable = false)
    private UUID paymentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InvoiceStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(nullable = false, updatable = false)
    private long subtotal;

    @Column(nullable = false, updatable = false)
    private long cgst;

    @Column(nullable = false, updatable = false)
    private long sgst;

    @Column(nullable = false, updatable = false)
    private long igst;

    @Column(nullable = false, updatable = false)
    private long tds;

    @Column(name = "total_amount", nullable = false, updatable = false)
    private long totalAmount;

    @Column(name = "document_url", length = 500)
    private String documentUrl;

    @Column(name = "issued_at")
    private Instant issuedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static InvoiceEntity fromDomain(Invoice invoice) {
        return new InvoiceEntity(
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getUserId(),
            invoice.getPaymentId(),
            invoice.getStatus(),
            invoice.getCurrency(),
            invoice.getSubtotal(),
            invoice.getCgst(),
            invoice.getSgst(),
            invoice.getIgst(),
            invoice.getTds(),
            invoice.getTotalAmount(),
            invoice.getDocumentUrl(),
            invoice.getIssuedAt(),
            invoice.getCreatedAt(),
            invoice.getUpdatedAt()
        );
    }

    public Invoice toDomain() {
        return Invoice.builder()
            .id(id)
            .invoiceNumber(invoiceNumber)
            .userId(userId)
            .paymentId(paymentId)
            .status(status)
            .currency(currency)
            .subtotal(subtotal)
            .cgst(cgst)
            .sgst(sgst)
            .igst(igst)
            .tds(tds)
            .totalAmount(totalAmount)
            .documentUrl(documentUrl)
            .issuedAt(issuedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(Invoice invoice) {
        this.status = invoice.getStatus();
        this.documentUrl = invoice.getDocumentUrl();
        this.issuedAt = invoice.getIssuedAt();
        this.updatedAt = invoice.getUpdatedAt();
    }
}
