package com.swisscoin.ledger.core.balance;

import com.swisscoin.ledger.core.ledger.PairwiseLedger;
import com.swisscoin.ledger.core.model.HomeSummary;
import com.swisscoin.ledger.core.model.MemberBalanceSummary;
import com.swisscoin.ledger.core.model.Participant;
import com.swisscoin.ledger.core.model.PayerContribution;
import com.swisscoin.ledger.core.model.Settlement;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.model.SubscriptionPayment;
import com.swisscoin.ledger.core.model.SubscriptionSettlement;
import com.swisscoin.ledger.core.model.Transaction;
import com.swisscoin.ledger.core.model.UserGroup;
import com.swisscoin.ledger.core.money.CurrencyBalance;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolls pairwise balances up to persons, groups, shared subscriptions and the home screen.
 * Every result is from {@code viewerId}'s side: positive means the other party owes the viewer.
 */
@Component
public class BalanceAggregator {

    private static final int SCALE = 10;

    private final PairwiseLedger ledger;

    public BalanceAggregator(PairwiseLedger ledger) {
        this.ledger = ledger;
    }

    public CurrencyBalance personBalance(String viewerId, String personId,
                                         Collection<Transaction> transactions, Collection<Settlement> settlements) {
        return ledger.aggregateBalance(transactions, settlements, viewerId, personId);
    }

    // ---------- Groups ----------

    /**
     * Sum of the viewer's balances with every other member, counting only group transactions
     * and settlements recorded from the group.
     */
    public CurrencyBalance groupBalance(String viewerId, UserGroup group,
                                       Collection<Transaction> transactions, Collection<Settlement> settlements) {
        CurrencyBalance total = CurrencyBalance.empty();
        List<Transaction> groupTxns = inGroup(group, transactions);
        List<Settlement> groupSettlements = settlementsInGroup(group, settlements);
        for (String member : group.memberIds()) {
            if (member.equals(viewerId)) continue;
            total.merge(ledger.aggregateBalance(groupTxns, groupSettlements, viewerId, member));
        }
        return total;
    }

    public List<MemberBalanceSummary> groupMemberBalances(String viewerId, UserGroup group,
                                                          Collection<Transaction> transactions,
                                                          Collection<Settlement> settlements,
                                                          Map<String, Participant> participants) {
        List<Transaction> groupTxns = inGroup(group, transactions);
        List<Settlement> groupSettlements = settlementsInGroup(group, settlements);
        List<MemberBalanceSummary> out = new ArrayList<>();
        for (String member : group.memberIds()) {
            if (member.equals(viewerId)) continue;
            CurrencyBalance paid = CurrencyBalance.empty();
            for (Transaction t : groupTxns) {
                for (PayerContribution p : t.effectivePayers()) {
                    if (p.participantId().equals(member)) paid.add(p.amount(), t.currencyCode());
                }
            }
            out.add(new MemberBalanceSummary(member, nameOf(member, participants),
                    ledger.aggregateBalance(groupTxns, groupSettlements, viewerId, member), paid));
        }
        out.sort(byName());
        return out;
    }

    // ---------- Subscriptions ----------

    /**
     * Viewer's overall position in a shared subscription, equal-share model: every payment is
     * divided by the subscriber count (other members plus the viewer).
     */
    public CurrencyBalance subscriptionUserBalance(String viewerId, Subscription sub,
                                                   Collection<SubscriptionPayment> payments,
                                                   Collection<SubscriptionSettlement> settlements) {
        CurrencyBalance balance = CurrencyBalance.empty();
        if (!sub.shared() || !sub.active()) return balance;
        String currency = Objects.requireNonNull(sub.currencyCode(), "currency of " + sub.id());
        List<String> others = otherMembers(viewerId, sub);
        BigDecimal count = BigDecimal.valueOf(others.size() + 1L);

        for (SubscriptionPayment p : payments) {
            if (!sub.id().equals(p.subscriptionId())) continue;
            BigDecimal perMember = p.amount().divide(count, SCALE, RoundingMode.HALF_EVEN);
            if (viewerId.equals(p.payerId())) {
                balance.add(p.amount().subtract(perMember), currency);
            } else if (p.payerId() != null) {
                balance.subtract(perMember, currency);
            }
        }
        for (SubscriptionSettlement s : settlements) {
            if (!sub.id().equals(s.subscriptionId())) continue;
            if (viewerId.equals(s.toParticipantId())) balance.subtract(s.amount(), currency);
            else if (viewerId.equals(s.fromParticipantId())) balance.add(s.amount(), currency);
        }
        return balance.rounded();
    }

    public List<MemberBalanceSummary> subscriptionMemberBalances(String viewerId, Subscription sub,
                                                                 Collection<SubscriptionPayment> payments,
                                                                 Collection<SubscriptionSettlement> settlements,
                                                                 Map<String, Participant> participants) {
        if (!sub.shared() || !sub.active()) return List.of();
        String currency = Objects.requireNonNull(sub.currencyCode(), "currency of " + sub.id());
        List<String> others = otherMembers(viewerId, sub);
        BigDecimal count = BigDecimal.valueOf(others.size() + 1L);

        List<MemberBalanceSummary> out = new ArrayList<>();
        for (String member : others) {
            CurrencyBalance balance = CurrencyBalance.empty();
            CurrencyBalance paid = CurrencyBalance.empty();
            for (SubscriptionPayment p : payments) {
                if (!sub.id().equals(p.subscriptionId())) continue;
                BigDecimal perMember = p.amount().divide(count, SCALE, RoundingMode.HALF_EVEN);
                if (viewerId.equals(p.payerId())) {
                    balance.add(perMember, currency);
                } else if (member.equals(p.payerId())) {
                    balance.subtract(perMember, currency);
                    paid.add(p.amount(), currency);
                }
            }
            for (SubscriptionSettlement s : settlements) {
                if (!sub.id().equals(s.subscriptionId())) continue;
                if (member.equals(s.fromParticipantId()) && viewerId.equals(s.toParticipantId())) {
                    balance.subtract(s.amount(), currency);
                } else if (viewerId.equals(s.fromParticipantId()) && member.equals(s.toParticipantId())) {
                    balance.add(s.amount(), currency);
                }
            }
            out.add(new MemberBalanceSummary(member, nameOf(member, participants), balance.rounded(), paid));
        }
        out.sort(byName());
        return out;
    }

    // ---------- Home ----------

    /**
     * Buckets every person's balance by sign, per currency; no netting across currencies.
     */
    public HomeSummary homeSummary(Map<String, CurrencyBalance> balancesByPerson) {
        CurrencyBalance youOwe = CurrencyBalance.empty();
        CurrencyBalance owedToYou = CurrencyBalance.empty();
        for (CurrencyBalance b : balancesByPerson.values()) {
            b.nonZero().forEach((code, amount) -> {
                if (amount.signum() < 0) youOwe.add(amount.negate(), code);
                else owedToYou.add(amount, code);
            });
        }
        return new HomeSummary(youOwe, owedToYou);
    }

    /**
     * Ids of people the viewer owes something to in at least one currency, largest debt first.
     */
    public List<String> peopleYouOwe(Map<String, CurrencyBalance> balancesByPerson) {
        return balancesByPerson.entrySet().stream()
                .filter(e -> e.getValue().hasNegative())
                .sorted(Comparator.comparing((Map.Entry<String, CurrencyBalance> e) -> largestDebt(e.getValue())).reversed()
                        .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static BigDecimal largestDebt(CurrencyBalance b) {
        return b.nonZero().values().stream()
                .filter(v -> v.signum() < 0)
                .map(BigDecimal::abs)
                .max(Comparator.naturalOrder())
                .orElse(BigDecimal.ZERO);
    }

    private static List<Transaction> inGroup(UserGroup group, Collection<Transaction> transactions) {
        return transactions.stream().filter(t -> group.id().equals(t.groupId())).toList();
    }

    private static List<Settlement> settlementsInGroup(UserGroup group, Collection<Settlement> settlements) {
        return settlements.stream().filter(s -> group.id().equals(s.groupId())).toList();
    }

    private static List<String> otherMembers(String viewerId, Subscription sub) {
        return sub.subscriberIds().stream().filter(id -> !id.equals(viewerId)).distinct().toList();
    }

    private static String nameOf(String id, Map<String, Participant> participants) {
        Participant p = participants.get(id);
        return p == null ? "Unknown" : p.safeName();
    }

    private static Comparator<MemberBalanceSummary> byName() {
        return Comparator.comparing(MemberBalanceSummary::displayName, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(MemberBalanceSummary::participantId);
    }
}
