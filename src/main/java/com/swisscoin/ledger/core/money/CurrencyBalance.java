package com.swisscoin.ledger.core.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Signed amounts per ISO currency code, seen from one viewer: positive means the other side
 * owes the viewer, negative means the viewer owes.
 * <p>
 * Entries below {@link #ZERO_THRESHOLD} in magnitude count as settled in every non-zero view.
 * Not thread-safe; instances are built inside a single computation and then handed out.
 */
public final class CurrencyBalance {

    public static final BigDecimal ZERO_THRESHOLD = new BigDecimal("0.01");

    private final Map<String, BigDecimal> balances = new TreeMap<>();

    public static CurrencyBalance empty() {
        return new CurrencyBalance();
    }

    public static CurrencyBalance of(String code, BigDecimal amount) {
        CurrencyBalance b = new CurrencyBalance();
        b.add(amount, code);
        return b;
    }

    public void add(BigDecimal amount, String currency) {
        Objects.requireNonNull(currency, "currency");
        balances.merge(currency, amount, BigDecimal::add);
    }

    public void subtract(BigDecimal amount, String currency) {
        add(amount.negate(), currency);
    }

    public void merge(CurrencyBalance other) {
        other.balances.forEach((code, amount) -> add(amount, code));
    }

    public BigDecimal get(String currency) {
        return balances.getOrDefault(currency, BigDecimal.ZERO);
    }

    /**
     * Raw entries, including near-zero ones.
     */
    public Map<String, BigDecimal> asMap() {
        return Collections.unmodifiableMap(balances);
    }

    public Map<String, BigDecimal> nonZero() {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        balances.forEach((code, amount) -> {
            if (amount.abs().compareTo(ZERO_THRESHOLD) >= 0) out.put(code, amount);
        });
        return out;
    }

    /**
     * Non-zero entries ordered by magnitude, largest first; ties by code.
     */
    public List<CurrencyAmount> sortedCurrencies() {
        return nonZero().entrySet().stream()
                .map(e -> new CurrencyAmount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparing((CurrencyAmount c) -> c.amount().abs()).reversed()
                        .thenComparing(CurrencyAmount::code))
                .toList();
    }

    public boolean isSettled() {
        return nonZero().isEmpty();
    }

    public Optional<String> singleCurrency() {
        Map<String, BigDecimal> nz = nonZero();
        return nz.size() == 1 ? Optional.of(nz.keySet().iterator().next()) : Optional.empty();
    }

    public boolean hasPositive() {
        return nonZero().values().stream().anyMatch(v -> v.signum() > 0);
    }

    public boolean hasNegative() {
        return nonZero().values().stream().anyMatch(v -> v.signum() < 0);
    }

    public BigDecimal primaryAmount() {
        List<CurrencyAmount> sorted = sortedCurrencies();
        return sorted.isEmpty() ? BigDecimal.ZERO : sorted.get(0).amount();
    }

    /**
     * Code of the largest entry, or {@code fallback} when everything is settled.
     */
    public String primaryCurrency(String fallback) {
        List<CurrencyAmount> sorted = sortedCurrencies();
        return sorted.isEmpty() ? fallback : sorted.get(0).code();
    }

    public int currencyCount() {
        return nonZero().size();
    }

    /**
     * Copy with every entry rounded to its currency's minor unit.
     */
    public CurrencyBalance rounded() {
        CurrencyBalance out = new CurrencyBalance();
        balances.forEach((code, amount) ->
                out.balances.put(code, amount.setScale(Currency.minorUnitsOf(code), RoundingMode.HALF_EVEN)));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CurrencyBalance other)) return false;
        return balances.equals(other.balances);
    }

    @Override
    public int hashCode() {
        return balances.hashCode();
    }

    @Override
    public String toString() {
        return "CurrencyBalance" + balances;
    }
}
