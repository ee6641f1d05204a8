package com.swisscoin.ledger.core.ledger;

import com.swisscoin.ledger.core.model.PayerContribution;
import com.swisscoin.ledger.core.model.Settlement;
import com.swisscoin.ledger.core.model.SplitShare;
import com.swisscoin.ledger.core.model.Transaction;
import com.swisscoin.ledger.core.money.CurrencyBalance;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Who owes whom within a transaction, and across a pair's history.
 * <p>
 * Each debtor's debt is spread over the creditors of the same transaction in proportion to what
 * each creditor is owed. This is not a minimal-transfer settlement graph. All methods are pure.
 */
@Component
public class PairwiseLedger {

    static final BigDecimal EPSILON = new BigDecimal("0.001");
    private static final int SCALE = 10;

    /**
     * paid minus owed, per participant appearing in the transaction.
     */
    public Map<String, BigDecimal> netPositions(Transaction t) {
        Map<String, BigDecimal> net = new TreeMap<>();
        for (PayerContribution p : t.effectivePayers()) {
            net.merge(p.participantId(), p.amount(), BigDecimal::add);
        }
        for (SplitShare s : t.splits()) {
            net.merge(s.participantId(), s.amount().negate(), BigDecimal::add);
        }
        return net;
    }

    /**
     * Signed amount {@code b} owes {@code a} because of this transaction; negative when
     * {@code a} owes {@code b}. Unrounded.
     */
    public BigDecimal pairwiseBalance(Transaction t, String a, String b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.equals(b)) throw new IllegalArgumentException("pairwise balance of a participant with itself: " + a);

        Map<String, BigDecimal> net = netPositions(t);
        BigDecimal totalCredit = net.values().stream()
                .filter(v -> v.compareTo(EPSILON) > 0)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalCredit.compareTo(EPSILON) <= 0) return BigDecimal.ZERO;

        BigDecimal netA = net.getOrDefault(a, BigDecimal.ZERO);
        BigDecimal netB = net.getOrDefault(b, BigDecimal.ZERO);
        if (isCreditor(netA) && isDebtor(netB)) return share(netA, netB, totalCredit);
        if (isCreditor(netB) && isDebtor(netA)) return share(netB, netA, totalCredit).negate();
        return BigDecimal.ZERO;
    }

    /**
     * Viewer's balance with {@code other} over every live transaction involving both, minus
     * settlements between them, rounded per currency.
     * Positive entries mean {@code other} owes the viewer.
     */
    public CurrencyBalance aggregateBalance(Collection<Transaction> transactions, Collection<Settlement> settlements,
                                            String viewer, String other) {
        if (Objects.equals(viewer, other)) {
            throw new IllegalArgumentException("viewer and counterpart must differ: " + viewer);
        }
        CurrencyBalance balance = CurrencyBalance.empty();
        for (Transaction t : transactions) {
            if (t.deleted() || !t.involves(viewer) || !t.involves(other)) continue;
            BigDecimal amount = pairwiseBalance(t, viewer, other);
            if (amount.signum() != 0) {
                balance.add(amount, Objects.requireNonNull(t.currencyCode(), "currency of " + t.id()));
            }
        }
        for (Settlement s : settlements) {
            if (s.deleted() || !s.isBetween(viewer, other)) continue;
            String currency = Objects.requireNonNull(s.currencyCode(), "currency of " + s.id());
            // other paid the viewer back: less owed to the viewer
            if (s.fromParticipantId().equals(other)) balance.subtract(s.amount(), currency);
            else balance.add(s.amount(), currency);
        }
        return balance.rounded();
    }

    private static BigDecimal share(BigDecimal creditorNet, BigDecimal debtorNet, BigDecimal totalCredit) {
        return debtorNet.abs().multiply(creditorNet).divide(totalCredit, SCALE, RoundingMode.HALF_EVEN);
    }

    private static boolean isCreditor(BigDecimal net) {
        return net.compareTo(EPSILON) > 0;
    }

    private static boolean isDebtor(BigDecimal net) {
        return net.compareTo(EPSILON.negate()) < 0;
    }
}
