package com.flagship.contractor_ledger.persistence;

/**
 * Hook invoked at the end of a mutating transaction, after the work succeeded but before
 * the database commit. Throwing from {@link #beforeCommit()} rolls the whole transaction back.
 */
public interface CommitListener {

    void beforeCommit();
}
