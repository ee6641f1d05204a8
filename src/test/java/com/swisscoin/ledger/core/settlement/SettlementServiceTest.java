package com.swisscoin.ledger.core.settlement;

import com.swisscoin.ledger.core.balance.BalanceAggregator;
import com.swisscoin.ledger.core.ledger.LedgerChangedEvent;
import com.swisscoin.ledger.core.ledger.PairwiseLedger;
import com.swisscoin.ledger.core.model.BillingCycle;
import com.swisscoin.ledger.core.model.Settlement;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.model.SubscriptionPayment;
import com.swisscoin.ledger.core.model.SubscriptionSettlement;
import com.swisscoin.ledger.core.model.UserGroup;
import com.swisscoin.ledger.core.money.CurrencyBalance;
import com.swisscoin.ledger.core.store.LedgerDataAccessException;
import com.swisscoin.ledger.core.store.SqliteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.swisscoin.ledger.core.LedgerFixtures.bd;
import static com.swisscoin.ledger.core.LedgerFixtures.txn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("SettlementService")
class SettlementServiceTest {

    private static final String V = "viewer";

    @TempDir
    Path dataDir;

    private SqliteRepository repo;
    private BalanceAggregator aggregator;
    private ApplicationEventPublisher events;
    private SettlementService service;

    @BeforeEach
    void setUp() {
        repo = new SqliteRepository(dataDir.toString(), "USD");
        aggregator = new BalanceAggregator(new PairwiseLedger());
        events = mock(ApplicationEventPublisher.class);
        service = new SettlementService(repo, aggregator, new SettlementProcessor(), events);
    }

    private static Map<String, String> map(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }

    private CurrencyBalance balanceWith(String other) {
        return aggregator.personBalance(V, other, repo.listTransactionsInvolving(V), repo.listSettlementsBetween(V, other));
    }

    @Nested
    @DisplayName("Single settlement")
    class Single {

        @BeforeEach
        void bobOwes() {
            repo.upsertTransaction(txn("USD", map(V, "85"), map(V, "42.50", "bob", "42.50")));
        }

        @Test
        @DisplayName("Should cap at 42.50 and then refuse a second settlement")
        void shouldCapThenRefuse() {
            SettlementResult first = service.settle(V, "bob", "USD", bd("100.00"), null);

            assertThat(first.amount()).isEqualByComparingTo("42.50");
            assertThat(first.capped()).isTrue();
            assertThat(balanceWith("bob").isSettled()).isTrue();
            assertThatThrownBy(() -> service.settle(V, "bob", "USD", bd("100.00"), null))
                    .isInstanceOfSatisfying(SettlementRejectedException.class,
                            e -> assertThat(e.reason()).isEqualTo(SettlementRejectedException.Reason.NO_OUTSTANDING_BALANCE));
            assertThat(repo.listSettlementsActive()).hasSize(1);
            verify(events).publishEvent(any(LedgerChangedEvent.class));
        }

        @Test
        @DisplayName("Should preview the capped amount without writing")
        void shouldPreviewWithoutWriting() {
            SettlementResult preview = service.preview(V, "bob", "USD", bd("50"));

            assertThat(preview.amount()).isEqualByComparingTo("42.50");
            assertThat(preview.capped()).isTrue();
            assertThat(repo.listSettlementsActive()).isEmpty();
            verify(events, never()).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("Should let only one of two concurrent settlements through")
        void shouldSerializeConcurrentSettlements() throws Exception {
            CountDownLatch start = new CountDownLatch(1);
            Callable<SettlementResult> attempt = () -> {
                start.await();
                return service.settle(V, "bob", "USD", bd("100.00"), null);
            };
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<SettlementResult> a = pool.submit(attempt);
                Future<SettlementResult> b = pool.submit(attempt);
                start.countDown();

                List<Object> outcomes = new ArrayList<>();
                for (Future<SettlementResult> f : List.of(a, b)) {
                    try {
                        outcomes.add(f.get(10, TimeUnit.SECONDS));
                    } catch (ExecutionException e) {
                        outcomes.add(e.getCause());
                    }
                }

                assertThat(outcomes).filteredOn(o -> o instanceof SettlementResult).hasSize(1);
                assertThat(outcomes).filteredOn(o -> o instanceof SettlementRejectedException).hasSize(1);
                assertThat(repo.listSettlementsActive()).singleElement()
                        .satisfies(s -> assertThat(s.amount()).isEqualByComparingTo("42.50"));
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Settle all")
    class SettleAll {

        @BeforeEach
        void threeCounterparts() {
            repo.upsertTransaction(txn("USD", map(V, "40"), map(V, "20", "alice", "20")));
            repo.upsertTransaction(txn("USD", map("bob", "30"), map(V, "15", "bob", "15")));
            repo.upsertTransaction(txn("USD", map(V, "10"), map(V, "5", "carol", "5")));
        }

        @Test
        @DisplayName("Should create one settlement per counterpart with matching directions")
        void shouldSettleEveryone() {
            List<Settlement> created = service.settleAll(V, List.of("alice", "bob", "carol", "dave"), "all square");

            assertThat(created).hasSize(3);
            assertThat(created).extracting(Settlement::fromParticipantId).containsExactly("alice", V, "carol");
            assertThat(created).extracting(Settlement::toParticipantId).containsExactly(V, "bob", V);
            assertThat(created).extracting(s -> s.amount().toPlainString()).containsExactly("20.00", "15.00", "5.00");
            assertThat(created).allMatch(Settlement::fullSettlement);
            for (String other : List.of("alice", "bob", "carol")) {
                assertThat(balanceWith(other).isSettled()).isTrue();
            }
        }

        @Test
        @DisplayName("Should persist nothing when the commit is interrupted")
        void shouldBeAllOrNothing() {
            SqliteRepository failing = new SqliteRepository(dataDir.toString(), "USD") {
                private int inserts;

                @Override
                public synchronized void insertSettlement(Settlement s) {
                    if (++inserts == 3) {
                        throw new LedgerDataAccessException("insert settlement " + s.id(), new SQLException("disk I/O error"));
                    }
                    super.insertSettlement(s);
                }
            };
            SettlementService flaky = new SettlementService(failing, aggregator, new SettlementProcessor(), events);

            assertThatThrownBy(() -> flaky.settleAll(V, List.of("alice", "bob", "carol"), null))
                    .isInstanceOf(LedgerDataAccessException.class);

            assertThat(failing.listSettlementsActive()).isEmpty();
            assertThat(repo.listSettlementsActive()).isEmpty();
            assertThat(balanceWith("alice").get("USD")).isEqualByComparingTo("20");
            assertThat(balanceWith("bob").get("USD")).isEqualByComparingTo("-15");
        }

        @Test
        @DisplayName("Should skip counterparts that are already settled")
        void shouldSkipSettled() {
            service.settle(V, "alice", "USD", null, null);

            List<Settlement> created = service.settleAll(V, List.of("alice", "bob"), null);

            assertThat(created).extracting(Settlement::toParticipantId).containsExactly("bob");
        }

        @Test
        @DisplayName("Should skip a one-cent balance instead of rejecting the batch")
        void shouldSkipPennyBalances() {
            repo.upsertTransaction(txn("USD", map(V, "0.02"), map(V, "0.01", "erin", "0.01")));

            List<Settlement> created = service.settleAll(V, List.of("alice", "erin"), null);

            assertThat(created).singleElement().satisfies(s -> {
                assertThat(s.fromParticipantId()).isEqualTo("alice");
                assertThat(s.amount()).isEqualByComparingTo("20.00");
            });
            assertThat(repo.listSettlementsActive()).hasSize(1);
            assertThat(balanceWith("erin").get("USD")).isEqualByComparingTo("0.01");
        }

        @Test
        @DisplayName("Should do nothing for an empty selection")
        void shouldHandleEmptySelection() {
            assertThat(service.settleAll(V, Collections.emptyList(), null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Scoped settlements")
    class Scoped {

        @Test
        @DisplayName("Should cap against the group balance and tag the settlement")
        void shouldSettleInGroup() {
            repo.upsertGroup(new UserGroup("g1", "Trip", List.of(V, "bob"), false));
            repo.upsertTransaction(txn("USD", map(V, "60"), map(V, "30", "bob", "30"), "g1"));
            repo.upsertTransaction(txn("USD", map(V, "100"), map(V, "50", "bob", "50")));

            SettlementResult r = service.settleInGroup(V, "g1", "bob", "USD", bd("80"), null);

            assertThat(r.amount()).isEqualByComparingTo("30");
            assertThat(r.settlement().groupId()).isEqualTo("g1");
            assertThat(repo.listSettlementsByGroup("g1")).hasSize(1);
            assertThat(balanceWith("bob").get("USD")).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("Should refuse an unknown group")
        void shouldRejectUnknownGroup() {
            assertThatThrownBy(() -> service.settleInGroup(V, "nope", "bob", "USD", bd("1"), null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should settle a subscription member's share")
        void shouldSettleSubscription() {
            repo.upsertSubscription(new Subscription("s1", "Music", bd("15"), "EUR", BillingCycle.MONTHLY, 0,
                    LocalDate.of(2024, 1, 1), true, true, List.of(V, "bob", "alice"), false));
            repo.insertSubscriptionPayment(new SubscriptionPayment("p1", "s1", V, bd("15"), 1L, null));

            SubscriptionSettlement s = service.settleSubscription(V, "s1", "bob", null, "thanks");

            assertThat(s.fromParticipantId()).isEqualTo("bob");
            assertThat(s.toParticipantId()).isEqualTo(V);
            assertThat(s.amount()).isEqualByComparingTo("5");
            assertThat(repo.listSubscriptionSettlements("s1")).hasSize(1);
            assertThatThrownBy(() -> service.settleSubscription(V, "s1", "bob", null, null))
                    .isInstanceOf(SettlementRejectedException.class);
        }
    }
}
