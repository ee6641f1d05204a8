package com.swisscoin.ledger.core.store;

import com.swisscoin.ledger.core.model.Participant;
import com.swisscoin.ledger.core.model.Settlement;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.model.SubscriptionPayment;
import com.swisscoin.ledger.core.model.SubscriptionSettlement;
import com.swisscoin.ledger.core.model.Transaction;
import com.swisscoin.ledger.core.model.UserGroup;

import java.util.List;
import java.util.function.Supplier;

public interface Repository {
    void init();

    /**
     * Runs {@code work} as one store transaction: everything it writes is committed together,
     * or rolled back if it throws. Nested calls join the outer transaction.
     */
    <T> T inTransaction(Supplier<T> work);

    // Participants
    void upsertParticipant(Participant p);

    Participant findParticipant(String id);

    List<Participant> listParticipantsActive();

    void tombstoneParticipant(String id);

    // Transactions (payer and split rows are replaced on upsert)
    void upsertTransaction(Transaction t);

    Transaction findTransaction(String id);

    List<Transaction> listTransactionsActive();

    List<Transaction> listTransactionsInvolving(String participantId);

    List<Transaction> listTransactionsByGroup(String groupId);

    void tombstoneTransaction(String id);

    void deleteTransaction(String id);

    // Settlements
    void insertSettlement(Settlement s);

    List<Settlement> listSettlementsActive();

    List<Settlement> listSettlementsBetween(String a, String b);

    List<Settlement> listSettlementsByGroup(String groupId);

    void tombstoneSettlement(String id);

    void deleteSettlement(String id);

    // Groups
    void upsertGroup(UserGroup g);

    UserGroup findGroup(String id);

    List<UserGroup> listGroupsActive();

    void tombstoneGroup(String id);

    // Subscriptions
    void upsertSubscription(Subscription s);

    Subscription findSubscription(String id);

    List<Subscription> listSubscriptionsActive();

    void deleteSubscription(String id);

    void insertSubscriptionPayment(SubscriptionPayment p);

    List<SubscriptionPayment> listSubscriptionPayments(String subscriptionId);

    void insertSubscriptionSettlement(SubscriptionSettlement s);

    List<SubscriptionSettlement> listSubscriptionSettlements(String subscriptionId);
}
