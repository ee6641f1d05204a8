package com.swisscoin.ledger.core.model;

import java.util.Locale;

public enum SplitMethod {
    EQUAL, AMOUNT, PERCENTAGE, SHARES, ADJUSTMENT;

    public static SplitMethod parse(String s) {
        if (s == null || s.isBlank()) return EQUAL;
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
