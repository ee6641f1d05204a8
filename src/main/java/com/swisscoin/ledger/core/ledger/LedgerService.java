package com.swisscoin.ledger.core.ledger;

import com.swisscoin.ledger.core.balance.BalanceAggregator;
import com.swisscoin.ledger.core.config.ViewerSession;
import com.swisscoin.ledger.core.model.HomeSummary;
import com.swisscoin.ledger.core.model.MemberBalanceSummary;
import com.swisscoin.ledger.core.model.Participant;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.model.SubscriptionPayment;
import com.swisscoin.ledger.core.model.Transaction;
import com.swisscoin.ledger.core.model.UserGroup;
import com.swisscoin.ledger.core.money.CurrencyBalance;
import com.swisscoin.ledger.core.split.TransactionDraft;
import com.swisscoin.ledger.core.split.TransactionFactory;
import com.swisscoin.ledger.core.split.TransactionRecalculator;
import com.swisscoin.ledger.core.store.Repository;
import com.swisscoin.ledger.core.subscription.SubscriptionSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads records from the store and hands them to the engine. Currencies are resolved here,
 * before anything reaches the calculators.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final Repository repo;
    private final TransactionFactory factory;
    private final TransactionRecalculator recalculator;
    private final BalanceAggregator aggregator;
    private final SubscriptionSchedule schedule;
    private final ViewerSession session;
    private final ApplicationEventPublisher events;

    public LedgerService(Repository repo, TransactionFactory factory, TransactionRecalculator recalculator,
                         BalanceAggregator aggregator, SubscriptionSchedule schedule, ViewerSession session,
                         ApplicationEventPublisher events) {
        this.repo = repo;
        this.factory = factory;
        this.recalculator = recalculator;
        this.aggregator = aggregator;
        this.schedule = schedule;
        this.session = session;
        this.events = events;
    }

    // ---------- Writes ----------

    public Transaction recordTransaction(TransactionDraft draft, String viewerId) {
        Transaction t = factory.create(resolveCurrency(draft), viewerId, this::displayName);
        repo.upsertTransaction(t);
        log.info("transaction {} recorded: {} {} {}", t.id(), t.title(), t.totalAmount(), t.currencyCode());
        events.publishEvent(new LedgerChangedEvent("transaction"));
        return t;
    }

    /**
     * Full edit: payer and split rows are rebuilt from the draft, the id is kept.
     */
    public Transaction updateTransaction(String id, TransactionDraft draft, String viewerId) {
        Transaction existing = requireTransaction(id);
        Transaction built = factory.create(resolveCurrency(draft), viewerId, this::displayName);
        Transaction t = new Transaction(existing.id(), built.title(), built.totalAmount(), built.currencyCode(), built.ts(),
                built.splitMethod(), built.payerId(), built.payers(), built.splits(), built.groupId(), built.note(),
                existing.createdBy(), existing.deleted());
        repo.upsertTransaction(t);
        events.publishEvent(new LedgerChangedEvent("transaction"));
        return t;
    }

    public Transaction editTransactionAmount(String id, BigDecimal newTotal) {
        Transaction t = recalculator.rescale(requireTransaction(id), newTotal);
        repo.upsertTransaction(t);
        log.info("transaction {} rescaled to {}", id, t.totalAmount());
        events.publishEvent(new LedgerChangedEvent("transaction"));
        return t;
    }

    /**
     * @param hard removes the row with its payer and split rows; otherwise leaves a tombstone
     */
    public void deleteTransaction(String id, boolean hard) {
        if (hard) repo.deleteTransaction(id);
        else repo.tombstoneTransaction(id);
        events.publishEvent(new LedgerChangedEvent("transaction"));
    }

    public SubscriptionPayment recordSubscriptionPayment(String subscriptionId, String payerId, BigDecimal amount,
                                                         String note, LocalDate today) {
        return repo.inTransaction(() -> {
            Subscription sub = requireSubscription(subscriptionId);
            SubscriptionPayment p = new SubscriptionPayment(UUID.randomUUID().toString(), subscriptionId, payerId,
                    amount == null ? sub.amount() : amount, System.currentTimeMillis(), note);
            repo.insertSubscriptionPayment(p);
            repo.upsertSubscription(schedule.advance(sub, today));
            events.publishEvent(new LedgerChangedEvent("subscription"));
            return p;
        });
    }

    // ---------- Reads ----------

    public CurrencyBalance personBalance(String viewerId, String personId) {
        return aggregator.personBalance(viewerId, personId,
                repo.listTransactionsInvolving(viewerId), repo.listSettlementsBetween(viewerId, personId));
    }

    public CurrencyBalance groupBalance(String viewerId, String groupId) {
        return aggregator.groupBalance(viewerId, requireGroup(groupId),
                repo.listTransactionsByGroup(groupId), repo.listSettlementsByGroup(groupId));
    }

    public List<MemberBalanceSummary> groupMemberBalances(String viewerId, String groupId) {
        return aggregator.groupMemberBalances(viewerId, requireGroup(groupId),
                repo.listTransactionsByGroup(groupId), repo.listSettlementsByGroup(groupId), participantsById());
    }

    public CurrencyBalance subscriptionUserBalance(String viewerId, String subscriptionId) {
        return aggregator.subscriptionUserBalance(viewerId, requireSubscription(subscriptionId),
                repo.listSubscriptionPayments(subscriptionId), repo.listSubscriptionSettlements(subscriptionId));
    }

    public List<MemberBalanceSummary> subscriptionMemberBalances(String viewerId, String subscriptionId) {
        return aggregator.subscriptionMemberBalances(viewerId, requireSubscription(subscriptionId),
                repo.listSubscriptionPayments(subscriptionId), repo.listSubscriptionSettlements(subscriptionId),
                participantsById());
    }

    /**
     * Viewer's balance with every other active participant, settled ones included.
     */
    public Map<String, CurrencyBalance> balancesByPerson(String viewerId) {
        List<Transaction> txns = repo.listTransactionsInvolving(viewerId);
        Map<String, CurrencyBalance> out = new LinkedHashMap<>();
        for (Participant p : repo.listParticipantsActive()) {
            if (p.id().equals(viewerId)) continue;
            out.put(p.id(), aggregator.personBalance(viewerId, p.id(), txns, repo.listSettlementsBetween(viewerId, p.id())));
        }
        return out;
    }

    public HomeSummary homeSummary(String viewerId) {
        return aggregator.homeSummary(balancesByPerson(viewerId));
    }

    public List<String> peopleYouOwe(String viewerId) {
        return aggregator.peopleYouOwe(balancesByPerson(viewerId));
    }

    private TransactionDraft resolveCurrency(TransactionDraft d) {
        return new TransactionDraft(d.title(), d.totalAmount(), session.currencyOrDefault(d.currencyCode()), d.ts(),
                d.splitMethod(), d.participantIds(), d.rawInputs(), d.paidBy(), d.groupId(), d.note());
    }

    private String displayName(String participantId) {
        Participant p = repo.findParticipant(participantId);
        return p == null ? participantId : p.safeName();
    }

    private Map<String, Participant> participantsById() {
        return repo.listParticipantsActive().stream()
                .collect(Collectors.toMap(Participant::id, Function.identity(), (a, b) -> a));
    }

    private Transaction requireTransaction(String id) {
        Transaction t = repo.findTransaction(id);
        if (t == null) throw new IllegalArgumentException("unknown transaction: " + id);
        return t;
    }

    private UserGroup requireGroup(String id) {
        UserGroup g = repo.findGroup(id);
        if (g == null) throw new IllegalArgumentException("unknown group: " + id);
        return g;
    }

    private Subscription requireSubscription(String id) {
        Subscription s = repo.findSubscription(id);
        if (s == null) throw new IllegalArgumentException("unknown subscription: " + id);
        return s;
    }
}
