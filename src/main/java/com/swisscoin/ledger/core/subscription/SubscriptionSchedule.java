package com.swisscoin.ledger.core.subscription;

import com.swisscoin.ledger.core.model.BillingCycle;
import com.swisscoin.ledger.core.model.Subscription;
import com.swisscoin.ledger.core.money.Currency;
import com.swisscoin.ledger.core.money.CurrencyBalance;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;

/**
 * Billing cycle arithmetic for subscriptions.
 */
@Component
public class SubscriptionSchedule {

    private static final BigDecimal WEEKS_PER_MONTH = new BigDecimal("4.33");
    private static final BigDecimal DAYS_PER_MONTH = new BigDecimal("30.44");
    private static final BigDecimal MONTHS_PER_YEAR = new BigDecimal("12");
    private static final int DUE_SOON_DAYS = 7;
    private static final int SCALE = 10;

    public BigDecimal monthlyEquivalent(Subscription s) {
        return round(rawMonthly(s), s.currencyCode());
    }

    public BigDecimal yearlyEquivalent(Subscription s) {
        return round(rawMonthly(s).multiply(MONTHS_PER_YEAR), s.currencyCode());
    }

    /**
     * Monthly cost of the active subscriptions, per currency.
     */
    public CurrencyBalance monthlyTotal(Collection<Subscription> subscriptions) {
        CurrencyBalance total = CurrencyBalance.empty();
        for (Subscription s : subscriptions) {
            if (s.active() && !s.deleted()) total.add(rawMonthly(s), s.currencyCode());
        }
        return total.rounded();
    }

    private BigDecimal rawMonthly(Subscription s) {
        BillingCycle cycle = s.cycle() == null ? BillingCycle.MONTHLY : s.cycle();
        return switch (cycle) {
            case WEEKLY -> s.amount().multiply(WEEKS_PER_MONTH);
            case MONTHLY -> s.amount();
            case YEARLY -> s.amount().divide(MONTHS_PER_YEAR, SCALE, RoundingMode.HALF_EVEN);
            case CUSTOM -> s.amount().multiply(DAYS_PER_MONTH)
                    .divide(BigDecimal.valueOf(customDays(s)), SCALE, RoundingMode.HALF_EVEN);
        };
    }

    /**
     * Billing date one cycle after {@code from}.
     */
    public LocalDate nextBillingDate(Subscription s, LocalDate from) {
        BillingCycle cycle = s.cycle() == null ? BillingCycle.MONTHLY : s.cycle();
        return switch (cycle) {
            case WEEKLY -> from.plusDays(7);
            case MONTHLY -> from.plusMonths(1);
            case YEARLY -> from.plusYears(1);
            case CUSTOM -> from.plusDays(customDays(s));
        };
    }

    /**
     * Copy of the subscription whose next billing date moved one cycle forward, e.g. after
     * recording a payment.
     */
    public Subscription advance(Subscription s, LocalDate today) {
        LocalDate from = s.nextBillingDate() == null ? today : s.nextBillingDate();
        return new Subscription(s.id(), s.name(), s.amount(), s.currencyCode(), s.cycle(), s.customCycleDays(),
                nextBillingDate(s, from), s.shared(), s.active(), s.subscriberIds(), s.deleted());
    }

    public long daysUntilDue(Subscription s, LocalDate today) {
        if (s.nextBillingDate() == null) return 0;
        return ChronoUnit.DAYS.between(today, s.nextBillingDate());
    }

    public BillingStatus status(Subscription s, LocalDate today) {
        if (!s.active()) return BillingStatus.PAUSED;
        long days = daysUntilDue(s, today);
        if (days < 0) return BillingStatus.OVERDUE;
        if (days <= DUE_SOON_DAYS) return BillingStatus.DUE;
        return BillingStatus.UPCOMING;
    }

    /**
     * Other subscribers plus the viewer, never less than one.
     */
    public int subscriberCount(Subscription s, String viewerId) {
        long others = s.subscriberIds().stream().filter(id -> !id.equals(viewerId)).distinct().count();
        return (int) Math.max(1, others + 1);
    }

    public BigDecimal perMemberShare(Subscription s, String viewerId) {
        if (!s.shared()) return round(s.amount(), s.currencyCode());
        return s.amount().divide(BigDecimal.valueOf(subscriberCount(s, viewerId)),
                Currency.minorUnitsOf(s.currencyCode()), RoundingMode.HALF_EVEN);
    }

    private static int customDays(Subscription s) {
        return Math.max(1, s.customCycleDays());
    }

    private static BigDecimal round(BigDecimal amount, String currencyCode) {
        return amount.setScale(Currency.minorUnitsOf(currencyCode), RoundingMode.HALF_EVEN);
    }
}
