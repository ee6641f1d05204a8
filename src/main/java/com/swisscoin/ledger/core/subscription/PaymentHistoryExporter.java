package com.swisscoin.ledger.core.subscription;

import com.swisscoin.ledger.core.model.Participant;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.model.SubscriptionPayment;
import com.swisscoin.ledger.core.money.MoneyFormatter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;

/**
 * CSV export of a subscription's payment history, newest first.
 */
@Component
public class PaymentHistoryExporter {

    static final String HEADER = "Date,Amount,Paid By,Split Amount,Notes";
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final SubscriptionSchedule schedule;

    public PaymentHistoryExporter(SubscriptionSchedule schedule) {
        this.schedule = schedule;
    }

    public String exportCsv(Subscription sub, Collection<SubscriptionPayment> payments, String viewerId,
                            Map<String, Participant> participants, ZoneId zone) {
        int count = schedule.subscriberCount(sub, viewerId);
        boolean showSplit = sub.shared() && count > 1;

        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        payments.stream()
                .filter(p -> sub.id().equals(p.subscriptionId()))
                .sorted(Comparator.comparingLong(SubscriptionPayment::ts).reversed())
                .forEach(p -> {
                    sb.append(DATE.format(Instant.ofEpochMilli(p.ts()).atZone(zone))).append(',');
                    sb.append(MoneyFormatter.plain(p.amount(), sub.currencyCode())).append(',');
                    sb.append(escape(payerName(p.payerId(), viewerId, participants))).append(',');
                    if (showSplit) {
                        BigDecimal split = p.amount().divide(BigDecimal.valueOf(count), 10, RoundingMode.HALF_EVEN);
                        sb.append(MoneyFormatter.plain(split, sub.currencyCode()));
                    }
                    sb.append(',');
                    sb.append(escape(p.note() == null ? "" : p.note()));
                    sb.append('\n');
                });
        return sb.toString();
    }

    private static String payerName(String payerId, String viewerId, Map<String, Participant> participants) {
        if (payerId == null) return "Unknown";
        if (payerId.equals(viewerId)) return "You";
        Participant p = participants.get(payerId);
        return p == null ? "Unknown" : p.safeName();
    }

    static String escape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
