package com.flagship.contractor_ledger.persistence;

/**
 * Lifecycle of the single ledger transaction.
 *
 * IDLE -> BEGUN -> (COMMITTED | ROLLED_BACK) -> IDLE
 */
public enum BoundaryState {
    /** No transaction is open */
    IDLE,
    /** Work is running against the stores */
    BEGUN,
    /** The work succeeded and its changes are durable */
    COMMITTED,
    /** The work failed and every change it made was discarded */
    ROLLED_BACK
}
