package com.swisscoin.ledger.core.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public record Currency(
        String code,
        String symbol,
        String name,
        String flag,
        int minorUnits // 2 for cents, 0 for JPY/KRW
) {
    public static final List<Currency> ALL = List.of(
            new Currency("USD", "$", "US Dollar", "🇺🇸", 2),
            new Currency("EUR", "€", "Euro", "🇪🇺", 2),
            new Currency("GBP", "£", "British Pound", "🇬🇧", 2),
            new Currency("INR", "₹", "Indian Rupee", "🇮🇳", 2),
            new Currency("CNY", "¥", "Chinese Yuan", "🇨🇳", 2),
            new Currency("JPY", "¥", "Japanese Yen", "🇯🇵", 0),
            new Currency("CHF", "CHF", "Swiss Franc", "🇨🇭", 2),
            new Currency("CAD", "CA$", "Canadian Dollar", "🇨🇦", 2),
            new Currency("AUD", "A$", "Australian Dollar", "🇦🇺", 2),
            new Currency("KRW", "₩", "South Korean Won", "🇰🇷", 0),
            new Currency("SGD", "S$", "Singapore Dollar", "🇸🇬", 2),
            new Currency("AED", "د.إ", "UAE Dirham", "🇦🇪", 2),
            new Currency("BRL", "R$", "Brazilian Real", "🇧🇷", 2),
            new Currency("MXN", "MX$", "Mexican Peso", "🇲🇽", 2),
            new Currency("SEK", "kr", "Swedish Krona", "🇸🇪", 2)
    );

    public static Optional<Currency> find(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim().toUpperCase(Locale.ROOT);
        return ALL.stream().filter(x -> x.code.equals(c)).findFirst();
    }

    /**
     * Known currency for the code, USD otherwise.
     */
    public static Currency fromCode(String code) {
        return find(code).orElse(ALL.get(0));
    }

    /**
     * Minor units for any code; unknown codes use two decimals.
     */
    public static int minorUnitsOf(String code) {
        return find(code).map(Currency::minorUnits).orElse(2);
    }

    public BigDecimal round(BigDecimal amount) {
        return amount.setScale(minorUnits, RoundingMode.HALF_EVEN);
    }
}
