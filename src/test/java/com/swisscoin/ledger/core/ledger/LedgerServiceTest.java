package com.swisscoin.ledger.core.ledger;

import com.swisscoin.ledger.core.balance.BalanceAggregator;
import com.swisscoin.ledger.core.config.ViewerSession;
import com.swisscoin.ledger.core.model.BillingCycle;
import com.swisscoin.ledger.core.model.HomeSummary;
import com.swisscoin.ledger.core.model.MemberBalanceSummary;
import com.swisscoin.ledger.core.model.Participant;
import com.swisscoin.ledger.core.model.PayerContribution;
import com.swisscoin.ledger.core.model.SplitMethod;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.model.SubscriptionPayment;
import com.swisscoin.ledger.core.model.Transaction;
import com.swisscoin.ledger.core.model.UserGroup;
import com.swisscoin.ledger.core.split.SplitCalculator;
import com.swisscoin.ledger.core.split.TransactionDraft;
import com.swisscoin.ledger.core.split.TransactionFactory;
import com.swisscoin.ledger.core.split.TransactionRecalculator;
import com.swisscoin.ledger.core.store.SqliteRepository;
import com.swisscoin.ledger.core.subscription.SubscriptionSchedule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.swisscoin.ledger.core.LedgerFixtures.bd;
import static com.swisscoin.ledger.core.LedgerFixtures.settlement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("LedgerService")
class LedgerServiceTest {

    private static final String ME = "me";

    @TempDir
    Path dataDir;

    private SqliteRepository repo;
    private ApplicationEventPublisher events;
    private LedgerService ledger;

    @BeforeEach
    void setUp() {
        repo = new SqliteRepository(dataDir.toString(), "CHF");
        events = mock(ApplicationEventPublisher.class);
        ViewerSession session = new ViewerSession("CHF");
        session.viewerId = ME;
        SubscriptionSchedule schedule = new SubscriptionSchedule();
        ledger = new LedgerService(repo, new TransactionFactory(new SplitCalculator()), new TransactionRecalculator(),
                new BalanceAggregator(new PairwiseLedger()), schedule, session, events);

        repo.upsertParticipant(new Participant(ME, "Me", false));
        repo.upsertParticipant(new Participant("anna", "Anna", false));
        repo.upsertParticipant(new Participant("ben", "Ben", false));
    }

    private static TransactionDraft dinner(String currency) {
        return TransactionDraft.equalSplit("Dinner", bd("90.00"), currency, List.of(ME, "anna", "ben"));
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("Should record with the default currency when none is given")
        void shouldUseDefaultCurrency() {
            Transaction t = ledger.recordTransaction(dinner(null), ME);

            assertThat(t.currencyCode()).isEqualTo("CHF");
            assertThat(repo.findTransaction(t.id()).splits()).hasSize(3);
            assertThat(ledger.personBalance(ME, "anna").get("CHF")).isEqualByComparingTo("30.00");
            verify(events).publishEvent(any(LedgerChangedEvent.class));
        }

        @Test
        @DisplayName("Should rescale an edited amount and keep the split method")
        void shouldRescale() {
            Transaction t = ledger.recordTransaction(dinner("EUR"), ME);

            Transaction edited = ledger.editTransactionAmount(t.id(), bd("30.00"));

            assertThat(edited.totalAmount()).isEqualByComparingTo("30.00");
            assertThat(edited.splitMethod()).isEqualTo(SplitMethod.EQUAL);
            assertThat(repo.findTransaction(t.id()).splits())
                    .allSatisfy(s -> assertThat(s.amount()).isEqualByComparingTo("10.00"));
            assertThat(ledger.personBalance(ME, "ben").get("EUR")).isEqualByComparingTo("10.00");
        }

        @Test
        @DisplayName("Should rebuild payers and splits on a full edit and keep the author")
        void shouldUpdate() {
            Transaction t = ledger.recordTransaction(dinner("USD"), ME);
            Map<String, BigDecimal> paidBy = new LinkedHashMap<>();
            paidBy.put("anna", null);
            TransactionDraft draft = new TransactionDraft("Dinner + tip", bd("100.00"), "USD", t.ts(), SplitMethod.EQUAL,
                    List.of(ME, "anna"), Map.of(), paidBy, null, null);

            Transaction updated = ledger.updateTransaction(t.id(), draft, "anna");

            assertThat(updated.id()).isEqualTo(t.id());
            assertThat(updated.createdBy()).isEqualTo(ME);
            assertThat(updated.payers()).extracting(PayerContribution::participantId).containsExactly("anna");
            assertThat(ledger.personBalance(ME, "anna").get("USD")).isEqualByComparingTo("-50.00");
            assertThat(ledger.personBalance(ME, "ben").isSettled()).isTrue();
        }

        @Test
        @DisplayName("Should drop a deleted transaction from balances")
        void shouldDelete() {
            Transaction soft = ledger.recordTransaction(dinner("USD"), ME);
            Transaction hard = ledger.recordTransaction(dinner("USD"), ME);

            ledger.deleteTransaction(soft.id(), false);
            ledger.deleteTransaction(hard.id(), true);

            assertThat(repo.findTransaction(soft.id()).deleted()).isTrue();
            assertThat(repo.findTransaction(hard.id())).isNull();
            assertThat(ledger.homeSummary(ME).owedToYou().isSettled()).isTrue();
        }

        @Test
        @DisplayName("Should keep a soft-deleted transaction deleted after a full edit")
        void shouldNotRestoreOnUpdate() {
            Transaction t = ledger.recordTransaction(dinner("USD"), ME);
            ledger.deleteTransaction(t.id(), false);

            ledger.updateTransaction(t.id(), dinner("USD"), ME);

            assertThat(repo.findTransaction(t.id()).deleted()).isTrue();
            assertThat(ledger.personBalance(ME, "anna").isSettled()).isTrue();
        }

        @Test
        @DisplayName("Should reject unknown ids")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> ledger.editTransactionAmount("nope", bd("1")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ledger.groupBalance(ME, "nope"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Summaries")
    class Summaries {

        @Test
        @DisplayName("Should aggregate per currency across people")
        void shouldSummarizeHome() {
            ledger.recordTransaction(dinner("USD"), ME);
            Map<String, BigDecimal> annaPaid = new LinkedHashMap<>();
            annaPaid.put("anna", null);
            ledger.recordTransaction(new TransactionDraft("Taxi", bd("40.00"), "EUR", 0L, SplitMethod.EQUAL,
                    List.of(ME, "anna"), Map.of(), annaPaid, null, null), ME);
            repo.insertSettlement(settlement("ben", ME, "30.00", "USD"));

            HomeSummary home = ledger.homeSummary(ME);

            assertThat(home.owedToYou().get("USD")).isEqualByComparingTo("30.00");
            assertThat(home.youOwe().get("EUR")).isEqualByComparingTo("20.00");
            assertThat(ledger.peopleYouOwe(ME)).containsExactly("anna");
            assertThat(ledger.balancesByPerson(ME)).containsOnlyKeys("anna", "ben");
            assertThat(ledger.balancesByPerson(ME).get("ben").isSettled()).isTrue();
        }

        @Test
        @DisplayName("Should compute group balances from group transactions only")
        void shouldSummarizeGroup() {
            repo.upsertGroup(new UserGroup("trip", "Trip", List.of(ME, "anna", "ben"), false));
            TransactionDraft d = dinner("USD");
            ledger.recordTransaction(new TransactionDraft(d.title(), d.totalAmount(), d.currencyCode(), d.ts(),
                    d.splitMethod(), d.participantIds(), d.rawInputs(), d.paidBy(), "trip", null), ME);
            ledger.recordTransaction(dinner("USD"), ME);

            assertThat(ledger.groupBalance(ME, "trip").get("USD")).isEqualByComparingTo("60.00");
            List<MemberBalanceSummary> members = ledger.groupMemberBalances(ME, "trip");
            assertThat(members).extracting(MemberBalanceSummary::displayName).contains("Anna", "Ben");
        }
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("Should record a payment and advance the billing date")
        void shouldRecordPayment() {
            repo.upsertSubscription(new Subscription("music", "Music", bd("15.00"), "USD", BillingCycle.MONTHLY, 0,
                    LocalDate.of(2024, 3, 1), true, true, List.of(ME, "anna", "ben"), false));

            SubscriptionPayment p = ledger.recordSubscriptionPayment("music", ME, null, null, LocalDate.of(2024, 3, 2));

            assertThat(p.amount()).isEqualByComparingTo("15.00");
            assertThat(repo.findSubscription("music").nextBillingDate()).isEqualTo(LocalDate.of(2024, 4, 1));
            assertThat(ledger.subscriptionUserBalance(ME, "music").get("USD")).isEqualByComparingTo("10.00");
            assertThat(ledger.subscriptionMemberBalances(ME, "music")).hasSize(2);
            verify(events, atLeastOnce()).publishEvent(any(LedgerChangedEvent.class));
        }
    }
}
