package com.swisscoin.ledger.core.model;

import com.swisscoin.ledger.core.money.CurrencyBalance;

/**
 * Per-member view of a group or shared subscription, from the viewer's side:
 * a positive balance means the member owes the viewer.
 */
public record MemberBalanceSummary(
        String participantId,
        String displayName,
        CurrencyBalance balance,
        CurrencyBalance totalPaid
) {
}
