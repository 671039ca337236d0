package com.flagship.contractor_ledger.persistence;

import com.flagship.contractor_ledger.allocation.PaymentAllocation;
import com.flagship.contractor_ledger.category.Category;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.transaction.LedgerTransaction;
import com.flagship.contractor_ledger.trash.TrashEntry;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * The whole ledger as one self-contained document.
 *
 * Older snapshots may lack sections added by later migrations (allocations before version 2);
 * missing sections read as empty lists.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LedgerSnapshot {

    public static final String FORMAT = "contractor-ledger-snapshot";

    String format;
    int schemaVersion;
    @Singular
    List<AppliedMigration> migrations;
    @Singular
    List<Company> companies;
    @Singular
    List<Category> categories;
    @Singular
    List<Project> projects;
    @Singular
    List<LedgerTransaction> transactions;
    @Singular
    List<PaymentAllocation> allocations;
    @Singular("trashEntry")
    List<TrashEntry> trash;
}
