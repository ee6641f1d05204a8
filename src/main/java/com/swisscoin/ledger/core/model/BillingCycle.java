package com.swisscoin.ledger.core.model;

public enum BillingCycle {
    WEEKLY, MONTHLY, YEARLY, CUSTOM
}
