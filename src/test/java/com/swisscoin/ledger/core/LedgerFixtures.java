package com.swisscoin.ledger.core;

import com.swisscoin.ledger.core.model.PayerContribution;
import com.swisscoin.ledger.core.model.Settlement;
import com.swisscoin.ledger.core.model.SplitMethod;
import com.swisscoin.ledger.core.model.SplitShare;
import com.swisscoin.ledger.core.model.Transaction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builders shared by the ledger tests.
 */
public final class LedgerFixtures {

    private LedgerFixtures() {
    }

    public static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    /**
     * Transaction with explicit payer rows and exact split amounts. Map iteration order is kept.
     */
    public static Transaction txn(String currency, Map<String, String> paid, Map<String, String> owed) {
        return txn(currency, paid, owed, null);
    }

    public static Transaction txn(String currency, Map<String, String> paid, Map<String, String> owed, String groupId) {
        List<PayerContribution> payers = new ArrayList<>();
        paid.forEach((id, amount) -> payers.add(new PayerContribution(id, bd(amount))));
        List<SplitShare> splits = new ArrayList<>();
        owed.forEach((id, amount) -> splits.add(new SplitShare(id, bd(amount), bd(amount))));
        BigDecimal total = payers.stream().map(PayerContribution::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
        String payerId = payers.isEmpty() ? null : payers.get(0).participantId();
        return new Transaction(UUID.randomUUID().toString(), "Dinner", total, currency, System.currentTimeMillis(),
                SplitMethod.AMOUNT, payerId, payers, splits, groupId, null, payerId, false);
    }

    public static Settlement settlement(String from, String to, String amount, String currency) {
        return settlement(from, to, amount, currency, null);
    }

    public static Settlement settlement(String from, String to, String amount, String currency, String groupId) {
        return new Settlement(UUID.randomUUID().toString(), from, to, bd(amount), currency,
                System.currentTimeMillis(), null, false, groupId, false);
    }
}
