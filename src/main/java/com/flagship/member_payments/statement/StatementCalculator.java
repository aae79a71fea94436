package com.flagship.member_payments.statement;

import com.flagship.member_payments.payment.CurrencyCode;
import com.flagship.member_payments.payment.Payment;
import com.flagship.member_payments.payment.PaymentPersistenceService;
import com.flagship.member_payments.tax.TaxCalculationStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * Computes statement totals from the payment ledger.
 *
 * The range is inclusive of both dates, in the document zone: payments whose
 * completion instant falls in [from 00:00, to+1 00:00). Tax is taken on the
 * aggregate total, not summed per line, so line taxes may differ from the total
 * by rounding.
 */
@Component
public class StatementCalculator {

    private final PaymentPersistenceService paymentPersistenceService;
    private final TaxCalculationStrategy taxStrategy;
    private final ZoneId zone;

    public StatementCalculator(PaymentPersistenceService paymentPersistenceService,
                               TaxCalculationStrategy taxStrategy,
                               @Value("${documents.numbering.zone:Asia/Kolkata}") String zone) {
        this.paymentPersistenceService = paymentPersistenceService;
        this.taxStrategy = taxStrategy;
        this.zone = ZoneId.of(zone);
    }

    public StatementTotals calculate(UUID userId, CurrencyCode currency, LocalDate from, LocalDate to) {
        Instant start = from.atStartOfDay(zone).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(zone).toInstant();

        List<Payment> payments = paymentPersistenceService.findCompletedBetween(userId, currency, start, end);
        long totalInvested = payments.stream().mapToLong(Payment::getAmount).sum();
        long totalTax = taxStrategy.totalTax(totalInvested);
        long totalRefunded = paymentPersistenceService.sumRefundedBetween(userId, currency, start, end);

        List<StatementLine> lines = payments.stream()
            .map(payment -> new StatementLine(
                payment.getId(),
                payment.getCompletedAt(),
                payment.getType(),
                payment.getDescription() != null ? payment.getDescription() : "Payment",
                payment.getGatewayPaymentId(),
                payment.getAmount(),
                taxStrategy.totalTax(payment.getAmount())))
            .toList();

        return new StatementTotals(totalInvested, totalRefunded, totalTax, totalInvested - totalTax,
            payments.size(), lines);
    }
}
