package com.swisscoin.ledger.core.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Display strings for amounts, e.g. {@code $1,234.50}, {@code -€12.00}, {@code ¥1,500}.
 */
public final class MoneyFormatter {

    private MoneyFormatter() {
    }

    public static String format(BigDecimal amount, String currencyCode) {
        Currency c = Currency.fromCode(currencyCode);
        String body = number(amount.abs(), c.minorUnits());
        return (amount.signum() < 0 && !isZero(amount, c) ? "-" : "") + c.symbol() + body;
    }

    public static String formatAbsolute(BigDecimal amount, String currencyCode) {
        return format(amount.abs(), currencyCode);
    }

    /**
     * Like {@link #format} but with an explicit {@code +} for positive amounts.
     */
    public static String signed(BigDecimal amount, String currencyCode) {
        Currency c = Currency.fromCode(currencyCode);
        if (amount.signum() > 0 && !isZero(amount, c)) return "+" + format(amount, currencyCode);
        return format(amount, currencyCode);
    }

    /**
     * Plain number without symbol, used for CSV export.
     */
    public static String plain(BigDecimal amount, String currencyCode) {
        int digits = Currency.fromCode(currencyCode).minorUnits();
        return amount.setScale(digits, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static boolean isZero(BigDecimal amount, Currency c) {
        return amount.setScale(c.minorUnits(), RoundingMode.HALF_EVEN).signum() == 0;
    }

    private static String number(BigDecimal amount, int digits) {
        // DecimalFormat n'est pas thread-safe : une instance par appel
        DecimalFormat df = new DecimalFormat(digits == 0 ? "#,##0" : "#,##0." + "0".repeat(digits),
                DecimalFormatSymbols.getInstance(Locale.US));
        df.setRoundingMode(RoundingMode.HALF_EVEN);
        return df.format(amount);
    }
}
