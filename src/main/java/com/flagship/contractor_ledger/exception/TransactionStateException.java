package com.flagship.contractor_ledger.exception;

/**
 * The transaction boundary was used out of order: a nested begin, or a mutation
 * attempted with no open transaction.
 */
public class TransactionStateException extends LedgerException {

    public TransactionStateException(String message) {
        super(message);
    }
}
