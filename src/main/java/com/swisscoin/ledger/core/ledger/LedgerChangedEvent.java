package com.swisscoin.ledger.core.ledger;

/**
 * Published after any write that can move a balance.
 */
public record LedgerChangedEvent(String what) {
}
