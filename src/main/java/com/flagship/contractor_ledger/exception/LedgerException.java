package com.flagship.contractor_ledger.exception;

/**
 * Base type for every error raised by the ledger core.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
