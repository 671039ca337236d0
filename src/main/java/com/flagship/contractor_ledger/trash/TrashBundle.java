package com.flagship.contractor_ledger.trash;

import com.flagship.contractor_ledger.allocation.PaymentAllocation;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.transaction.LedgerTransaction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Every row removed by one delete, restorable together with original ids.
 */
@Value
@Builder
@Jacksonized
public class TrashBundle {
    @Singular
    List<Company> companies;
    @Singular
    List<Project> projects;
    @Singular
    List<LedgerTransaction> transactions;
    @Singular
    List<PaymentAllocation> allocations;
}
