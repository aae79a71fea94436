package com.flagship.member_payments.tax;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Flat GST plus withholding (TDS) at configured rates, 18% and 1% by default.
 *
 * Every line rounds half-up to the minor unit. TDS is derived as
 * {@code round(amount x (gst + tds)) - gst} so that an invoice's lines always add
 * up to the same total tax a statement reports for that amount.
 */
@Component
public class FixedCompositeTaxStrategy implements TaxCalculationStrategy {

    private final BigDecimal gstRate;
    private final BigDecimal withholdingRate;

    public FixedCompositeTaxStrategy(@Value("${tax.gst-rate:0.18}") BigDecimal gstRate,
                                     @Value("${tax.withholding-rate:0.01}") BigDecimal withholdingRate) {
        if (gstRate.signum() < 0 || withholdingRate.signum() < 0) {
            throw new IllegalArgumentException("Tax rates must not be negative");
        }
        this.gstRate = gstRate;
        this.withholdingRate = withholdingRate;
    }

    @Override
    public TaxBreakdown breakdown(long amount, boolean interstate) {
        long gst = apply(amount, gstRate);
        long tds = totalTax(amount) - gst;
        if (interstate) {
            return new TaxBreakdown(0, 0, gst, tds);
        }
        long cgst = gst / 2;
        return new TaxBreakdown(cgst, gst - cgst, 0, tds);
    }

    @Override
    public long totalTax(long amount) {
        return apply(amount, gstRate.add(withholdingRate));
    }

    private static long apply(long amount, BigDecimal rate) {
        return BigDecimal.valueOf(amount)
            .multiply(rate)
            .setScale(0, RoundingMode.HALF_UP)
            .longValueExact();
    }
}
