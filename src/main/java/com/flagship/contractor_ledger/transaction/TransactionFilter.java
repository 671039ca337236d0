package com.flagship.contractor_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Listing filter. Every criterion is optional; the empty filter selects all transactions.
 */
@Value
@Builder
public class TransactionFilter {

    public static final TransactionFilter ALL = TransactionFilter.builder().build();

    TransactionScope scope;
    TransactionType type;
    UUID companyId;
    UUID projectId;
    LocalDate startDate;
    LocalDate endDate;
    /** Case-insensitive match on description, document number and company name */
    String search;
    Integer limit;

    public static TransactionFilter forCompany(UUID companyId) {
        return TransactionFilter.builder().companyId(companyId).build();
    }

    public static TransactionFilter forProject(UUID projectId) {
        return TransactionFilter.builder().projectId(projectId).build();
    }
}
