package com.flagship.member_payments.invoice;

import com.flagship.member_payments.payment.CurrencyCode;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.tax.TaxBreakdown;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Tax invoice for one completed payment.
 *
 * The total equals the amount paid; tax lines are carved out of it, so
 * {@code subtotal + cgst + sgst + igst + tds == totalAmount} always holds.
 */
@Value
@Builder(toBuilder = true)
public class Invoice {
    UUID id;
    String invoiceNumber;
    UUID userId;
    UUID paymentId;
    InvoiceStatus status;
    CurrencyCode currency;
    long subtotal;
    long cgst;
    long sgst;
    long igst;
    long tds;
    long totalAmount;
    String documentUrl;
    Instant issuedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Invoice paid(String invoiceNumber, Payment payment, TaxBreakdown tax, Instant now) {
        return Invoice.builder()
            .id(UUID.randomUUID())
            .invoiceNumber(invoiceNumber)
            .userId(payment.getUserId())
            .paymentId(payment.getId())
            .status(InvoiceStatus.PAID)
            .currency(payment.getCurrency())
            .subtotal(payment.getAmount() - tax.getTotalTax())
            .cgst(tax.getCgst())
            .sgst(tax.getSgst())
            .igst(tax.getIgst())
            .tds(tax.getTds())
            .totalAmount(payment.getAmount())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Links the stored document. Only valid from PAID.
     *
     * @throws IllegalStateException if the invoice was already issued
     */
    public Invoice issue(String documentUrl, Instant now) {
        if (this.status != InvoiceStatus.PAID) {
            throw new IllegalStateException(
                String.format("Cannot issue invoice %s in %s status. Only PAID invoices can be issued.",
                    invoiceNumber, status));
        }
        return toBuilder()
            .status(InvoiceStatus.ISSUED)
            .documentUrl(documentUrl)
            .issuedAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean isIssued() {
        return status == InvoiceStatus.ISSUED;
    }
}
