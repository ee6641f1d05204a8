package com.swisscoin.ledger.core.split;

import com.swisscoin.ledger.core.model.PayerContribution;
import com.swisscoin.ledger.core.model.SplitMethod;
import com.swisscoin.ledger.core.model.Transaction;
import com.swisscoin.ledger.core.money.Currency;
import com.swisscoin.ledger.core.money.MinorUnitAllocator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Validates a {@link TransactionDraft} and builds the transaction with its payer and split rows.
 * Nothing is persisted here.
 */
@Component
public class TransactionFactory {

    static final String TITLE_REQUIRED = "Please enter a title";
    static final String PAYERS_MISMATCH = "Paid-by amounts must equal the total";

    private static final BigDecimal CENT_TOLERANCE = new BigDecimal("0.01");

    private final SplitCalculator calculator;

    public TransactionFactory(SplitCalculator calculator) {
        this.calculator = calculator;
    }

    public Transaction create(TransactionDraft draft, String viewerId) {
        return create(draft, viewerId, Function.identity());
    }

    /**
     * @param displayName resolves a payer id to its name; the legacy payer of a transaction the
     *                    viewer did not pay for is the first payer by name
     */
    public Transaction create(TransactionDraft draft, String viewerId, Function<String, String> displayName) {
        Objects.requireNonNull(viewerId, "viewerId");
        Objects.requireNonNull(draft.currencyCode(), "currencyCode");
        String title = draft.title() == null ? "" : draft.title().trim();
        if (title.isEmpty()) throw new InvalidSplitInputException(TITLE_REQUIRED);

        int minor = Currency.minorUnitsOf(draft.currencyCode());
        BigDecimal total = SplitCalculator.validateTotal(draft.totalAmount(), minor);
        SplitMethod method = draft.splitMethod() == null ? SplitMethod.EQUAL : draft.splitMethod();

        SplitComputation split = calculator.computeSplits(total, method, draft.participantIds(),
                draft.rawInputs(), draft.currencyCode());
        List<PayerContribution> payers = payers(draft.paidBy(), total, viewerId, minor);
        String legacyPayer = legacyPayer(payers, viewerId, displayName);

        String note = draft.note() == null || draft.note().isBlank() ? null : draft.note().trim();
        return new Transaction(UUID.randomUUID().toString(), title, total, draft.currencyCode(), draft.ts(),
                method, legacyPayer, payers, split.shares(), draft.groupId(), note, viewerId, false);
    }

    private static List<PayerContribution> payers(Map<String, BigDecimal> paidBy, BigDecimal total,
                                                  String viewerId, int minor) {
        if (paidBy.isEmpty()) return List.of(new PayerContribution(viewerId, total));
        if (paidBy.size() == 1) return List.of(new PayerContribution(paidBy.keySet().iterator().next(), total));

        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> e : paidBy.entrySet()) {
            BigDecimal v = e.getValue() == null ? BigDecimal.ZERO : e.getValue();
            if (v.signum() < 0) throw new InvalidSplitInputException(PAYERS_MISMATCH);
            amounts.put(e.getKey(), v);
            sum = sum.add(v);
        }
        if (sum.subtract(total).abs().compareTo(CENT_TOLERANCE) >= 0) {
            throw new InvalidSplitInputException(PAYERS_MISMATCH);
        }
        Map<String, BigDecimal> allocated = MinorUnitAllocator.byWeights(total, amounts, minor);
        List<PayerContribution> out = new ArrayList<>();
        allocated.forEach((id, amount) -> {
            if (amount.signum() > 0) out.add(new PayerContribution(id, amount));
        });
        return out;
    }

    private static String legacyPayer(List<PayerContribution> payers, String viewerId, Function<String, String> displayName) {
        if (payers.stream().anyMatch(p -> p.participantId().equals(viewerId))) return viewerId;
        return payers.stream()
                .map(PayerContribution::participantId)
                .min(Comparator.comparing((String id) -> String.valueOf(displayName.apply(id)), String.CASE_INSENSITIVE_ORDER)
                        .thenComparing(Comparator.naturalOrder()))
                .orElse(viewerId);
    }
}
