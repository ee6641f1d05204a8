package com.swisscoin.ledger.core.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a total into whole minor units so that the parts always add up to the total.
 * <p>
 * Leftover units go by largest fractional remainder; ties follow the iteration order of the
 * keys, which callers keep sorted by participant id.
 */
public final class MinorUnitAllocator {

    private static final int RATIO_SCALE = 10;

    private MinorUnitAllocator() {
    }

    public static Map<String, BigDecimal> equal(BigDecimal total, List<String> keys, int minorUnits) {
        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        for (String k : keys) weights.put(k, BigDecimal.ONE);
        return byWeights(total, weights, minorUnits);
    }

    /**
     * @param weights non-negative weights, at least one of them positive
     */
    public static Map<String, BigDecimal> byWeights(BigDecimal total, Map<String, BigDecimal> weights, int minorUnits) {
        BigDecimal sumWeights = weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (sumWeights.signum() <= 0) {
            throw new IllegalArgumentException("weights must add up to a positive value");
        }
        BigDecimal totalUnits = total.setScale(minorUnits, RoundingMode.HALF_EVEN).movePointRight(minorUnits);

        List<Slot> slots = new ArrayList<>();
        BigDecimal assigned = BigDecimal.ZERO;
        int index = 0;
        for (Map.Entry<String, BigDecimal> e : weights.entrySet()) {
            BigDecimal exact = totalUnits.multiply(e.getValue()).divide(sumWeights, RATIO_SCALE, RoundingMode.HALF_EVEN);
            BigDecimal floor = exact.setScale(0, RoundingMode.FLOOR);
            slots.add(new Slot(e.getKey(), index++, floor, exact.subtract(floor)));
            assigned = assigned.add(floor);
        }

        int leftover = totalUnits.subtract(assigned).intValueExact();
        List<Slot> byRemainder = new ArrayList<>(slots);
        byRemainder.sort(Comparator.comparing(Slot::remainder).reversed().thenComparingInt(Slot::order));
        for (int i = 0; i < leftover; i++) {
            Slot s = byRemainder.get(i % byRemainder.size());
            s.units = s.units.add(BigDecimal.ONE);
        }

        Map<String, BigDecimal> out = new LinkedHashMap<>();
        for (Slot s : slots) out.put(s.key, s.units.movePointLeft(minorUnits).setScale(minorUnits, RoundingMode.UNNECESSARY));
        return out;
    }

    private static final class Slot {
        final String key;
        final int order;
        final BigDecimal remainder;
        BigDecimal units;

        Slot(String key, int order, BigDecimal units, BigDecimal remainder) {
            this.key = key;
            this.order = order;
            this.units = units;
            this.remainder = remainder;
        }

        BigDecimal remainder() {
            return remainder;
        }

        int order() {
            return order;
        }
    }
}
