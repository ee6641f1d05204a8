package com.swisscoin.ledger.core.subscription;

public enum BillingStatus {
    PAUSED, OVERDUE, DUE, UPCOMING
}
