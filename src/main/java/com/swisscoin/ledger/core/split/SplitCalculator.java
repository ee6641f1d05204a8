package com.swisscoin.ledger.core.split;

import com.swisscoin.ledger.core.model.SplitMethod;
import com.swisscoin.ledger.core.model.SplitShare;
import com.swisscoin.ledger.core.money.Currency;
import com.swisscoin.ledger.core.money.MinorUnitAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a total, a split method and per-participant raw inputs into owed amounts.
 * <p>
 * Amounts are whole minor units of the currency and always add up to the (rounded) total.
 * Leftover units are handed out in ascending participant id order, which is also the order of
 * the returned shares.
 */
@Component
public class SplitCalculator {

    private static final Logger log = LoggerFactory.getLogger(SplitCalculator.class);

    public static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999.99");

    static final String AMOUNT_NOT_POSITIVE = "Amount must be greater than zero";
    static final String AMOUNT_TOO_LARGE = "Amount exceeds maximum allowed";
    static final String NO_PARTICIPANTS = "Select at least one person to split with";
    static final String DUPLICATE_PARTICIPANT = "A person can only appear once in a split";
    static final String AMOUNTS_MISMATCH = "Amounts must equal the total";
    static final String NEGATIVE_AMOUNT = "Amounts cannot be negative";
    static final String PERCENTAGES_MISMATCH = "Percentages must add up to 100%";
    static final String PERCENTAGE_RANGE = "Percentages must be between 0 and 100";
    static final String SHARES_INVALID = "Shares must be whole numbers";
    static final String SHARES_EMPTY = "Enter shares for at least one person";
    static final String ADJUSTMENTS_EXCEED = "Adjustments cannot exceed the total amount";

    private static final BigDecimal CENT_TOLERANCE = new BigDecimal("0.01");
    private static final BigDecimal PERCENT_TOLERANCE = new BigDecimal("0.1");
    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int SCALE = 10;

    public SplitComputation computeSplits(BigDecimal total, SplitMethod method,
                                          List<String> participants, Map<String, BigDecimal> rawInputs) {
        return computeSplits(total, method, participants, rawInputs, null);
    }

    /**
     * @param rawInputs percentage, share count, exact amount or signed adjustment per participant;
     *                  ignored for {@link SplitMethod#EQUAL}, missing entries count as zero
     * @param currencyCode decides the minor unit; {@code null} means two decimals
     */
    public SplitComputation computeSplits(BigDecimal total, SplitMethod method, List<String> participants,
                                          Map<String, BigDecimal> rawInputs, String currencyCode) {
        Objects.requireNonNull(method, "method");
        int minor = currencyCode == null ? 2 : Currency.minorUnitsOf(currencyCode);
        BigDecimal amount = validateTotal(total, minor);
        List<String> ids = sortedParticipants(participants);
        Map<String, BigDecimal> raw = rawInputs == null ? Map.of() : rawInputs;

        return switch (method) {
            case EQUAL -> equal(amount, ids, minor);
            case AMOUNT -> exactAmounts(amount, ids, raw, minor);
            case PERCENTAGE -> percentages(amount, ids, raw, minor);
            case SHARES -> shares(amount, ids, raw, minor);
            case ADJUSTMENT -> adjustments(amount, ids, raw, minor);
        };
    }

    /**
     * Rounds the total to minor units and checks its bounds.
     */
    public static BigDecimal validateTotal(BigDecimal total, int minorUnits) {
        if (total == null) throw new InvalidSplitInputException(AMOUNT_NOT_POSITIVE);
        BigDecimal rounded = total.setScale(minorUnits, RoundingMode.HALF_EVEN);
        if (rounded.signum() <= 0) throw new InvalidSplitInputException(AMOUNT_NOT_POSITIVE);
        if (rounded.compareTo(MAX_AMOUNT) > 0) throw new InvalidSplitInputException(AMOUNT_TOO_LARGE);
        return rounded;
    }

    private static List<String> sortedParticipants(List<String> participants) {
        if (participants == null || participants.isEmpty()) throw new InvalidSplitInputException(NO_PARTICIPANTS);
        Set<String> seen = new HashSet<>();
        for (String p : participants) {
            Objects.requireNonNull(p, "participant id");
            if (!seen.add(p)) throw new InvalidSplitInputException(DUPLICATE_PARTICIPANT);
        }
        List<String> ids = new ArrayList<>(participants);
        ids.sort(null);
        return ids;
    }

    private SplitComputation equal(BigDecimal total, List<String> ids, int minor) {
        Map<String, BigDecimal> amounts = MinorUnitAllocator.equal(total, ids, minor);
        return build(ids, amounts, Map.of(), List.of());
    }

    private SplitComputation exactAmounts(BigDecimal total, List<String> ids, Map<String, BigDecimal> raw, int minor) {
        Map<String, BigDecimal> inputs = inputsFor(ids, raw);
        for (BigDecimal v : inputs.values()) {
            if (v.signum() < 0) throw new InvalidSplitInputException(NEGATIVE_AMOUNT);
        }
        if (sum(inputs).subtract(total).abs().compareTo(CENT_TOLERANCE) >= 0) {
            throw new InvalidSplitInputException(AMOUNTS_MISMATCH);
        }
        // inputs within tolerance: only sub-unit residue is redistributed
        return build(ids, MinorUnitAllocator.byWeights(total, inputs, minor), inputs, List.of());
    }

    private SplitComputation percentages(BigDecimal total, List<String> ids, Map<String, BigDecimal> raw, int minor) {
        Map<String, BigDecimal> inputs = inputsFor(ids, raw);
        for (BigDecimal v : inputs.values()) {
            if (v.signum() < 0 || v.compareTo(HUNDRED) > 0) throw new InvalidSplitInputException(PERCENTAGE_RANGE);
        }
        if (sum(inputs).subtract(HUNDRED).abs().compareTo(PERCENT_TOLERANCE) > 0) {
            throw new InvalidSplitInputException(PERCENTAGES_MISMATCH);
        }
        return build(ids, MinorUnitAllocator.byWeights(total, inputs, minor), inputs, List.of());
    }

    private SplitComputation shares(BigDecimal total, List<String> ids, Map<String, BigDecimal> raw, int minor) {
        Map<String, BigDecimal> inputs = inputsFor(ids, raw);
        for (BigDecimal v : inputs.values()) {
            if (v.signum() < 0 || v.stripTrailingZeros().scale() > 0) throw new InvalidSplitInputException(SHARES_INVALID);
        }
        if (sum(inputs).signum() == 0) throw new InvalidSplitInputException(SHARES_EMPTY);
        return build(ids, MinorUnitAllocator.byWeights(total, inputs, minor), inputs, List.of());
    }

    private SplitComputation adjustments(BigDecimal total, List<String> ids, Map<String, BigDecimal> raw, int minor) {
        Map<String, BigDecimal> inputs = inputsFor(ids, raw);
        BigDecimal adjustmentSum = sum(inputs);
        if (adjustmentSum.compareTo(total) > 0) throw new InvalidSplitInputException(ADJUSTMENTS_EXCEED);

        List<String> receivers = ids.stream().filter(id -> inputs.get(id).signum() == 0).toList();
        if (receivers.isEmpty()) receivers = ids;

        BigDecimal base = total.divide(BigDecimal.valueOf(ids.size()), SCALE, RoundingMode.HALF_EVEN);
        BigDecimal offset = adjustmentSum.divide(BigDecimal.valueOf(receivers.size()), SCALE, RoundingMode.HALF_EVEN);

        Map<String, BigDecimal> targets = new LinkedHashMap<>();
        List<SplitWarning> warnings = new ArrayList<>();
        for (String id : ids) {
            BigDecimal t = base.add(inputs.get(id));
            if (receivers.contains(id)) t = t.subtract(offset);
            if (t.signum() < 0) {
                warnings.add(new SplitWarning(SplitWarning.Kind.CLAMPED_TO_ZERO, id, t.setScale(minor, RoundingMode.HALF_EVEN)));
                log.debug("adjustment share for {} clamped to zero (was {})", id, t);
                t = BigDecimal.ZERO;
            }
            targets.put(id, t);
        }
        // clamped shares are taken back proportionally from the others by the weighting
        return build(ids, MinorUnitAllocator.byWeights(total, targets, minor), inputs, warnings);
    }

    private static Map<String, BigDecimal> inputsFor(List<String> ids, Map<String, BigDecimal> raw) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        for (String id : ids) {
            BigDecimal v = raw.get(id);
            out.put(id, v == null ? BigDecimal.ZERO : v);
        }
        return out;
    }

    private static BigDecimal sum(Map<String, BigDecimal> values) {
        return values.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static SplitComputation build(List<String> ids, Map<String, BigDecimal> amounts,
                                          Map<String, BigDecimal> inputs, List<SplitWarning> warnings) {
        List<SplitShare> shares = new ArrayList<>(ids.size());
        for (String id : ids) {
            shares.add(new SplitShare(id, amounts.get(id), inputs.get(id)));
        }
        return new SplitComputation(shares, warnings);
    }
}
