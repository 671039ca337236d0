package com.flagship.contractor_ledger.exception;

/**
 * A write would break a ledger invariant. Messages name the invariant and never carry
 * storage identifiers, so they are safe to show to the user as-is.
 */
public class ConstraintViolationException extends LedgerException {

    public ConstraintViolationException(String message) {
        super(message);
    }
}
