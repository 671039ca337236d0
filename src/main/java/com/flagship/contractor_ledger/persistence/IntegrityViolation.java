package com.flagship.contractor_ledger.persistence;

import lombok.Value;

import java.util.UUID;

/**
 * A stored row that breaks a ledger invariant, as found by a diagnostic scan.
 */
@Value
public class IntegrityViolation {
    /** Name of the check that found it, such as {@code invoice_over_allocated} */
    String check;
    String table;
    UUID rowId;
    String detail;
}
