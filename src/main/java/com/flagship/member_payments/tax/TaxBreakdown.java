package com.flagship.member_payments.tax;

import lombok.Value;

/**
 * Tax lines for one tax-inclusive amount, in minor units.
 * Either CGST and SGST are set (intrastate) or IGST is (interstate).
 */
@Value
public class TaxBreakdown {
    long cgst;
    long sgst;
    long igst;
    long tds;

    public long getGst() {
        return cgst + sgst + igst;
    }

    public long getTotalTax() {
        return getGst() + tds;
    }
}
