package com.swisscoin.ledger.core.settlement;

public class SettlementRejectedException extends RuntimeException {

    public enum Reason {
        NO_OUTSTANDING_BALANCE("There is no outstanding balance to settle"),
        INVALID_AMOUNT("Settlement amount must be greater than zero");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public SettlementRejectedException(Reason reason) {
        super(reason.message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
