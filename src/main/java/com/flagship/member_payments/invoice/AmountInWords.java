package com.flagship.member_payments.invoice;

import com.flagship.member_payments.payment.CurrencyCode;

/**
 * Spells out amounts for the "amount in words" line of an invoice, using the
 * Indian scale (thousand, lakh, crore): 25000000 paise -> "Two Lakh Fifty
 * Thousand Rupees Only".
 */
final class AmountInWords {

    private static final String[] ONES = {
        "", "One", "Two", "Three", "Four", "Five", "Six", "Seven", "Eight", "Nine"
    };
    private static final String[] TEENS = {
        "Ten", "Eleven", "Twelve", "Thirteen", "Fourteen", "Fifteen",
        "Sixteen", "Seventeen", "Eighteen", "Nineteen"
    };
    private static final String[] TENS = {
        "", "", "Twenty", "Thirty", "Forty", "Fifty", "Sixty", "Seventy", "Eighty", "Ninety"
    };

    private AmountInWords() {
    }

    static String of(long minorUnits, CurrencyCode currency) {
        if (minorUnits < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + minorUnits);
        }
        String major = currency == CurrencyCode.INR ? "Rupees" : currency.name();
        String minor = currency == CurrencyCode.INR ? "Paise" : "Cents";

        long whole = minorUnits / 100;
        long fraction = minorUnits % 100;
        if (whole == 0 && fraction == 0) {
            return "Zero " + major + " Only";
        }

        StringBuilder words = new StringBuilder();
        if (whole > 0) {
            words.append(spell(whole)).append(' ').append(major);
        }
        if (fraction > 0) {
            if (whole > 0) {
                words.append(" and ");
            }
            words.append(spell(fraction)).append(' ').append(minor);
        }
        return words.append(" Only").toString();
    }

    static String spell(long n) {
        if (n == 0) {
            return "Zero";
        }
        if (n < 10) {
            return ONES[(int) n];
        }
        if (n < 20) {
            return TEENS[(int) n - 10];
        }
        if (n < 100) {
            return TENS[(int) (n / 10)] + (n % 10 != 0 ? " " + ONES[(int) (n % 10)] : "");
        }
        if (n < 1_000) {
            return ONES[(int) (n / 100)] + " Hundred" + rest(n % 100);
        }
        if (n < 1_00_000) {
            return spell(n / 1_000) + " Thousand" + rest(n % 1_000);
        }
        if (n < 1_00_00_000) {
            return spell(n / 1_00_000) + " Lakh" + rest(n % 1_00_000);
        }
        return spell(n / 1_00_00_000) + " Crore" + rest(n % 1_00_00_000);
    }

    private static String rest(long remainder) {
        return remainder != 0 ? " " + spell(remainder) : "";
    }
}
