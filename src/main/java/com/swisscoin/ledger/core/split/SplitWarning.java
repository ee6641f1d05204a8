package com.swisscoin.ledger.core.split;

import java.math.BigDecimal;

public record SplitWarning(Kind kind, String participantId, BigDecimal requestedAmount) {

    public enum Kind {
        CLAMPED_TO_ZERO
    }

    public String message() {
        return switch (kind) {
            case CLAMPED_TO_ZERO -> "Adjustment for " + participantId + " would make their share negative ("
                    + requestedAmount.toPlainString() + "); share set to zero";
        };
    }
}
