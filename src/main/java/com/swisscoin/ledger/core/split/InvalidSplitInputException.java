package com.swisscoin.ledger.core.split;

/**
 * Raised when amounts, payers or split inputs do not reconcile. The message is meant to be
 * shown to the user as-is.
 */
public class InvalidSplitInputException extends RuntimeException {
    public InvalidSplitInputException(String message) {
        super(message);
    }
}
