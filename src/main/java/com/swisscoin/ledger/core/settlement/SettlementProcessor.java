package com.swisscoin.ledger.core.settlement;

import com.swisscoin.ledger.core.model.Settlement;
import com.swisscoin.ledger.core.money.Currency;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.UUID;

/**
 * Validates a settlement against an outstanding balance and decides its amount and direction.
 * Callers must pass a balance read at commit time; see {@link SettlementService}.
 */
@Component
public class SettlementProcessor {

    static final BigDecimal ZERO_THRESHOLD = new BigDecimal("0.01");

    /**
     * @param outstanding viewer's balance with {@code otherId} in {@code currencyCode}: positive
     *                    when the other party owes the viewer
     * @param requested   {@code null} settles the full outstanding amount
     */
    public SettlementResult create(String viewerId, String otherId, BigDecimal requested, BigDecimal outstanding,
                                   String currencyCode, String note, long ts, String groupId) {
        Objects.requireNonNull(currencyCode, "currencyCode");
        int minor = Currency.minorUnitsOf(currencyCode);
        BigDecimal owed = outstanding == null ? BigDecimal.ZERO : outstanding.setScale(minor, RoundingMode.HALF_EVEN);
        if (!isOutstanding(owed, currencyCode)) {
            throw new SettlementRejectedException(SettlementRejectedException.Reason.NO_OUTSTANDING_BALANCE);
        }

        BigDecimal max = owed.abs();
        BigDecimal wanted = requested == null ? max : requested.setScale(minor, RoundingMode.HALF_EVEN);
        boolean capped = wanted.compareTo(max) > 0;
        BigDecimal amount = capped ? max : wanted;
        if (amount.signum() <= 0) {
            throw new SettlementRejectedException(SettlementRejectedException.Reason.INVALID_AMOUNT);
        }

        boolean otherPays = owed.signum() > 0;
        Settlement s = new Settlement(
                UUID.randomUUID().toString(),
                otherPays ? otherId : viewerId,
                otherPays ? viewerId : otherId,
                amount,
                currencyCode,
                ts,
                note,
                amount.compareTo(max) == 0,
                groupId,
                false
        );
        return new SettlementResult(s, requested, owed, capped);
    }

    /**
     * False when {@code outstanding}, rounded to minor units, is within one cent of zero.
     */
    public boolean isOutstanding(BigDecimal outstanding, String currencyCode) {
        if (outstanding == null) return false;
        BigDecimal owed = outstanding.setScale(Currency.minorUnitsOf(currencyCode), RoundingMode.HALF_EVEN);
        return owed.abs().compareTo(ZERO_THRESHOLD) > 0;
    }
}
