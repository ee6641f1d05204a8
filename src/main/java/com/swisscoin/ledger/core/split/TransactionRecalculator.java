package com.swisscoin.ledger.core.split;

import com.swisscoin.ledger.core.model.PayerContribution;
import com.swisscoin.ledger.core.model.SplitMethod;
import com.swisscoin.ledger.core.model.SplitShare;
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

/**
 * Amount-only edits: payer and split rows are rescaled proportionally to the new total.
 */
@Component
public class TransactionRecalculator {

    public Transaction rescale(Transaction t, BigDecimal newTotal) {
        int minor = Currency.minorUnitsOf(t.currencyCode());
        BigDecimal total = SplitCalculator.validateTotal(newTotal, minor);

        // legacy rows keep their single payer, which always pays the total
        List<PayerContribution> payers = new ArrayList<>();
        if (!t.payers().isEmpty()) {
            Map<String, BigDecimal> weights = new LinkedHashMap<>();
            t.payers().stream()
                    .sorted(Comparator.comparing(PayerContribution::participantId))
                    .forEach(p -> weights.merge(p.participantId(), p.amount(), BigDecimal::add));
            MinorUnitAllocator.byWeights(total, weights, minor)
                    .forEach((id, amount) -> payers.add(new PayerContribution(id, amount)));
        }

        List<SplitShare> splits = new ArrayList<>();
        if (!t.splits().isEmpty()) {
            List<SplitShare> sorted = t.splits().stream()
                    .sorted(Comparator.comparing(SplitShare::participantId))
                    .toList();
            Map<String, BigDecimal> allocated;
            if (t.splitMethod() == SplitMethod.EQUAL) {
                allocated = MinorUnitAllocator.equal(total, sorted.stream().map(SplitShare::participantId).toList(), minor);
            } else {
                Map<String, BigDecimal> weights = new LinkedHashMap<>();
                sorted.forEach(s -> weights.merge(s.participantId(), s.amount(), BigDecimal::add));
                allocated = MinorUnitAllocator.byWeights(total, weights, minor);
            }
            for (SplitShare s : sorted) {
                BigDecimal amount = allocated.get(s.participantId());
                // exact amounts are their own raw input
                BigDecimal raw = t.splitMethod() == SplitMethod.AMOUNT ? amount : s.rawInput();
                splits.add(new SplitShare(s.participantId(), amount, raw));
            }
        }
        return t.withAmounts(total, payers, splits);
    }
}
