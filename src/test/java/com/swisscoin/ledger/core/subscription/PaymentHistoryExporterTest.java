package com.swisscoin.ledger.core.subscription;

import com.swisscoin.ledger.core.model.BillingCycle;
import com.swisscoin.ledger.core.model.Participant;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.model.SubscriptionPayment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.swisscoin.ledger.core.LedgerFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PaymentHistoryExporter")
class PaymentHistoryExporterTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    private final PaymentHistoryExporter exporter = new PaymentHistoryExporter(new SubscriptionSchedule());
    private final Map<String, Participant> people = Map.of("a", new Participant("a", "Anna", false));

    private static long epoch(int year, int month, int day) {
        return LocalDate.of(year, month, day).atStartOfDay(UTC).toInstant().toEpochMilli();
    }

    private static Subscription subscription(boolean shared, List<String> members) {
        return new Subscription("s1", "Music", bd("15.00"), "USD", BillingCycle.MONTHLY, 0, null,
                shared, true, members, false);
    }

    @Test
    @DisplayName("Should list payments newest first with the viewer shown as You")
    void shouldExportNewestFirst() {
        List<SubscriptionPayment> payments = List.of(
                new SubscriptionPayment("p1", "s1", "me", bd("15"), epoch(2024, 1, 5), null),
                new SubscriptionPayment("p2", "s1", "a", bd("15"), epoch(2024, 2, 5), "February"),
                new SubscriptionPayment("p3", "other", "a", bd("99"), epoch(2024, 3, 5), null));

        String csv = exporter.exportCsv(subscription(true, List.of("me", "a", "b")), payments, "me", people, UTC);

        assertThat(csv.split("\n")).containsExactly(
                "Date,Amount,Paid By,Split Amount,Notes",
                "2024-02-05,15.00,Anna,5.00,February",
                "2024-01-05,15.00,You,5.00,");
    }

    @Test
    @DisplayName("Should leave the split column empty for personal subscriptions")
    void shouldSkipSplitForPersonal() {
        List<SubscriptionPayment> payments = List.of(
                new SubscriptionPayment("p1", "s1", "ghost", bd("15"), epoch(2024, 1, 5), null));

        String csv = exporter.exportCsv(subscription(false, List.of()), payments, "me", people, UTC);

        assertThat(csv).endsWith("2024-01-05,15.00,Unknown,,\n");
    }

    @Test
    @DisplayName("Should quote notes containing separators or quotes")
    void shouldQuoteNotes() {
        List<SubscriptionPayment> payments = List.of(
                new SubscriptionPayment("p1", "s1", "me", bd("15"), epoch(2024, 1, 5), "paid late, \"again\""));

        String csv = exporter.exportCsv(subscription(false, List.of()), payments, "me", people, UTC);

        assertThat(csv).contains(",\"paid late, \"\"again\"\"\"\n");
        assertThat(PaymentHistoryExporter.escape("plain")).isEqualTo("plain");
    }
}
