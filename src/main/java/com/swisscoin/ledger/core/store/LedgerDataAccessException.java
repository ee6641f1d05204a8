package com.swisscoin.ledger.core.store;

/**
 * Storage failure (SQL or file I/O). The current store transaction, if any, has been rolled back.
 */
public class LedgerDataAccessException extends RuntimeException {
    public LedgerDataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
