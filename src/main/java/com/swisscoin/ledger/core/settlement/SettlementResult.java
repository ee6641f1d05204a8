package com.swisscoin.ledger.core.settlement;

import com.swisscoin.ledger.core.model.Settlement;

import java.math.BigDecimal;

/**
 * @param capped true when the requested amount was larger than the outstanding balance and the
 *               settlement was reduced to it
 */
public record SettlementResult(Settlement settlement, BigDecimal requestedAmount, BigDecimal outstanding, boolean capped) {

    public BigDecimal amount() {
        return settlement.amount();
    }
}
