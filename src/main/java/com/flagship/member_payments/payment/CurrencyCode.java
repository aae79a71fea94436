package com.flagship.member_payments.payment;

import java.util.Locale;

/**
 * Currencies accepted for member payments (ISO-4217).
 *
 * Amounts are always stored in minor units; every supported currency has two
 * fraction digits. The locale drives how amounts are shown to members.
 */
public enum CurrencyCode {
    INR(Locale.forLanguageTag("en-IN")),
    USD(Locale.US),
    EUR(Locale.forLanguageTag("en-IE")),
    GBP(Locale.UK),
    SGD(Locale.forLanguageTag("en-SG")),
    AED(Locale.forLanguageTag("en-AE"));

    private final Locale displayLocale;

    CurrencyCode(Locale displayLocale) {
        this.displayLocale = displayLocale;
    }

    public Locale getDisplayLocale() {
        return displayLocale;
    }

    public int getFractionDigits() {
        return 2;
    }

    /**
     * Parses a currency code, rejecting anything outside the supported set.
     *
     * @throws IllegalArgumentException if the code is blank or unsupported
     */
    public static CurrencyCode fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency: " + code);
        }
    }
}
