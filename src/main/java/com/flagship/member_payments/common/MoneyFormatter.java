package com.flagship.member_payments.common;

import com.flagship.member_payments.payment.CurrencyCode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;

/**
 * Formats minor-unit amounts for members.
 *
 * INR uses Indian digit grouping (₹2,50,000.00) regardless of the JVM's locale data;
 * other currencies use the JDK currency format of their display locale.
 */
@Component
public class MoneyFormatter {

    public String format(long minorUnits, CurrencyCode currency) {
        if (currency == CurrencyCode.INR) {
            return "₹" + groupIndian(toMajor(minorUnits, currency));
        }
        NumberFormat format = NumberFormat.getCurrencyInstance(currency.getDisplayLocale());
        format.setCurrency(Currency.getInstance(currency.name()));
        format.setMinimumFractionDigits(currency.getFractionDigits());
        format.setMaximumFractionDigits(currency.getFractionDigits());
        return format.format(toMajor(minorUnits, currency));
    }

    /**
     * Plain decimal with no symbol or grouping, for CSV cells: 250000 paise -> "2500.00".
     */
    public String plain(long minorUnits, CurrencyCode currency) {
        return toMajor(minorUnits, currency).toPlainString();
    }

    static BigDecimal toMajor(long minorUnits, CurrencyCode currency) {
        return BigDecimal.valueOf(minorUnits, currency.getFractionDigits());
    }

    static String groupIndian(BigDecimal amount) {
        String sign = amount.signum() < 0 ? "-" : "";
        String plain = amount.abs().toPlainString();
        int dot = plain.indexOf('.');
        String whole = dot < 0 ? plain : plain.substring(0, dot);
        String fraction = dot < 0 ? "" : plain.substring(dot);

        if (whole.length() <= 3) {
            return sign + whole + fraction;
        }

        String lastThree = whole.substring(whole.length() - 3);
        String rest = whole.substring(0, whole.length() - 3);
        StringBuilder grouped = new StringBuilder();
        int firstGroup = rest.length() % 2;
        if (firstGroup > 0) {
            grouped.append(rest, 0, firstGroup);
        }
        for (int i = firstGroup; i < rest.length(); i += 2) {
            if (grouped.length() > 0) {
                grouped.append(',');
            }
            grouped.append(rest, i, i + 2);
        }
        return sign + grouped + "," + lastThree + fraction;
    }
}
