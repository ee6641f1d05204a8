package com.swisscoin.ledger.core.settlement;

import com.swisscoin.ledger.core.balance.BalanceAggregator;
import com.swisscoin.ledger.core.ledger.LedgerChangedEvent;
import com.swisscoin.ledger.core.model.MemberBalanceSummary;
import com.swisscoin.ledger.core.model.Settlement;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.model.SubscriptionSettlement;
import com.swisscoin.ledger.core.model.UserGroup;
import com.swisscoin.ledger.core.money.CurrencyBalance;
import com.swisscoin.ledger.core.store.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Records settlements. The outstanding balance is always re-read from the store inside the same
 * store transaction that writes the settlement, so two concurrent flows cannot both settle
 * against the same stale balance.
 */
@Service
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final Repository repo;
    private final BalanceAggregator aggregator;
    private final SettlementProcessor processor;
    private final ApplicationEventPublisher events;

    public SettlementService(Repository repo, BalanceAggregator aggregator, SettlementProcessor processor,
                             ApplicationEventPublisher events) {
        this.repo = repo;
        this.aggregator = aggregator;
        this.processor = processor;
        this.events = events;
    }

    /**
     * What {@link #settle} would record right now, without writing anything. Lets the caller show
     * the capped amount before the user confirms.
     */
    public SettlementResult preview(String viewerId, String otherId, String currencyCode, BigDecimal requested) {
        return repo.inTransaction(() -> processor.create(viewerId, otherId, requested,
                personBalance(viewerId, otherId).get(currencyCode), currencyCode, null, now(), null));
    }

    public SettlementResult settle(String viewerId, String otherId, String currencyCode, BigDecimal requested, String note) {
        SettlementResult result = repo.inTransaction(() -> {
            BigDecimal outstanding = personBalance(viewerId, otherId).get(currencyCode);
            SettlementResult r = processor.create(viewerId, otherId, requested, outstanding, currencyCode, note, now(), null);
            repo.insertSettlement(r.settlement());
            return r;
        });
        logRecorded(result);
        events.publishEvent(new LedgerChangedEvent("settlement"));
        return result;
    }

    /**
     * Settlement recorded from a group screen: capped against the group-only balance and tagged
     * with the group.
     */
    public SettlementResult settleInGroup(String viewerId, String groupId, String otherId, String currencyCode,
                                          BigDecimal requested, String note) {
        SettlementResult result = repo.inTransaction(() -> {
            UserGroup group = repo.findGroup(groupId);
            if (group == null || group.deleted()) throw new IllegalArgumentException("unknown group: " + groupId);
            BigDecimal outstanding = aggregator.personBalance(viewerId, otherId,
                    repo.listTransactionsByGroup(groupId), repo.listSettlementsByGroup(groupId)).get(currencyCode);
            SettlementResult r = processor.create(viewerId, otherId, requested, outstanding, currencyCode, note, now(), groupId);
            repo.insertSettlement(r.settlement());
            return r;
        });
        logRecorded(result);
        events.publishEvent(new LedgerChangedEvent("settlement"));
        return result;
    }

    /**
     * One full settlement per counterpart and non-zero currency, all committed together or not
     * at all. Counterparts already settled are skipped.
     */
    public List<Settlement> settleAll(String viewerId, Collection<String> counterpartIds, String note) {
        List<Settlement> settled = repo.inTransaction(() -> {
            List<Settlement> created = new ArrayList<>();
            for (String other : counterpartIds) {
                if (other.equals(viewerId)) continue;
                CurrencyBalance balance = personBalance(viewerId, other);
                for (Map.Entry<String, BigDecimal> e : balance.nonZero().entrySet()) {
                    // un centime restant ne bloque pas le lot
                    if (!processor.isOutstanding(e.getValue(), e.getKey())) continue;
                    SettlementResult result = processor.create(viewerId, other, null, e.getValue(), e.getKey(), note, now(), null);
                    repo.insertSettlement(result.settlement());
                    created.add(result.settlement());
                }
            }
            return created;
        });
        log.info("settle all: {} settlement(s) recorded for {} counterpart(s)", settled.size(), counterpartIds.size());
        if (!settled.isEmpty()) events.publishEvent(new LedgerChangedEvent("settlement"));
        return settled;
    }

    public SubscriptionSettlement settleSubscription(String viewerId, String subscriptionId, String memberId,
                                                     BigDecimal requested, String note) {
        SubscriptionSettlement settled = repo.inTransaction(() -> {
            Subscription sub = repo.findSubscription(subscriptionId);
            if (sub == null || sub.deleted()) throw new IllegalArgumentException("unknown subscription: " + subscriptionId);
            BigDecimal outstanding = aggregator.subscriptionMemberBalances(viewerId, sub,
                            repo.listSubscriptionPayments(subscriptionId), repo.listSubscriptionSettlements(subscriptionId), Map.of())
                    .stream()
                    .filter(m -> m.participantId().equals(memberId))
                    .map(MemberBalanceSummary::balance)
                    .findFirst()
                    .map(b -> b.get(sub.currencyCode()))
                    .orElse(BigDecimal.ZERO);
            Settlement s = processor.create(viewerId, memberId, requested, outstanding, sub.currencyCode(), note, now(), null)
                    .settlement();
            SubscriptionSettlement out = new SubscriptionSettlement(s.id(), subscriptionId, s.fromParticipantId(),
                    s.toParticipantId(), s.amount(), s.ts(), note);
            repo.insertSubscriptionSettlement(out);
            return out;
        });
        log.info("subscription {} settled: {} -> {} {}", subscriptionId, settled.fromParticipantId(),
                settled.toParticipantId(), settled.amount());
        events.publishEvent(new LedgerChangedEvent("subscription"));
        return settled;
    }

    private CurrencyBalance personBalance(String viewerId, String otherId) {
        return aggregator.personBalance(viewerId, otherId,
                repo.listTransactionsInvolving(viewerId), repo.listSettlementsBetween(viewerId, otherId));
    }

    private static void logRecorded(SettlementResult r) {
        Settlement s = r.settlement();
        if (r.capped()) {
            log.info("settlement capped from {} to outstanding {} {}", r.requestedAmount(), s.amount(), s.currencyCode());
        }
        log.info("settlement recorded: {} -> {} {} {}", s.fromParticipantId(), s.toParticipantId(), s.amount(), s.currencyCode());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
