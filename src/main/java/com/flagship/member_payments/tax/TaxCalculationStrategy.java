package com.flagship.member_payments.tax;

/**
 * Computes tax on amounts members paid. Amounts are tax-inclusive minor units.
 */
public interface TaxCalculationStrategy {

    /**
     * Itemized tax for a single payment.
     *
     * @param interstate true when the member is billed from another state (IGST instead of CGST + SGST)
     */
    TaxBreakdown breakdown(long amount, boolean interstate);

    /**
     * Aggregate tax over a total, as reported on statements.
     */
    long totalTax(long amount);
}
