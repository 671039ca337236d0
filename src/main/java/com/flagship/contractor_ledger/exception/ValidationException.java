package com.flagship.contractor_ledger.exception;

/**
 * Malformed or out-of-range input: a non-positive amount, a missing scope reference,
 * an unknown code.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }
}
