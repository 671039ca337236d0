package com.flagship.contractor_ledger.balance;

import com.flagship.contractor_ledger.common.Money;
import com.flagship.contractor_ledger.company.Company;
import com.flagship.contractor_ledger.company.CompanyStore;
import com.flagship.contractor_ledger.persistence.LedgerTransactionBoundary;
import com.flagship.contractor_ledger.project.Project;
import com.flagship.contractor_ledger.project.ProjectStatus;
import com.flagship.contractor_ledger.project.ProjectStore;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import com.flagship.contractor_ledger.transaction.TransactionFilter;
import com.flagship.contractor_ledger.transaction.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Loads the transactions of a view and hands them to {@link BalanceCalculator}.
 * Every read runs through the read boundary so a summary never mixes pre- and post-commit rows.
 */
@Service
@RequiredArgsConstructor
public class LedgerSummaryService {

    private final TransactionStore transactionStore;
    private final CompanyStore companyStore;
    private final ProjectStore projectStore;
    private final LedgerTransactionBoundary boundary;

    /**
     * Running account of a company over every transaction that references it, in any scope.
     */
    public CompanyLedger companyLedger(UUID companyId) {
        return boundary.withReadTransaction(() -> {
            companyStore.getById(companyId);
            return BalanceCalculator.calculateCompanyLedger(
                transactionStore.findDetails(TransactionFilter.forCompany(companyId)));
        });
    }

    public ProjectLedger projectLedger(UUID projectId) {
        return boundary.withReadTransaction(() -> {
            Project project = projectStore.getById(projectId);
            return BalanceCalculator.calculateProjectLedger(
                transactionStore.findDetails(TransactionFilter.forProject(projectId)),
                project.getOwnership(),
                project.getEstimatedBudget());
        });
    }

    public DashboardTotals dashboardTotals() {
        return boundary.withReadTransaction(() ->
            BalanceCalculator.calculateDashboardTotals(transactionStore.findDetails(TransactionFilter.ALL)));
    }

    public TransactionTotals transactionTotals(TransactionFilter filter) {
        return boundary.withReadTransaction(() ->
            BalanceCalculator.calculateTransactionTotals(transactionStore.findDetails(filter)));
    }

    public DashboardStats dashboardStats() {
        return boundary.withReadTransaction(() -> {
            List<TransactionDetails> all = transactionStore.findDetails(TransactionFilter.ALL);
            List<Project> projects = projectStore.findAll(null, true);
            List<Company> companies = companyStore.findAll(null, false);

            BigDecimal receivables = Money.ZERO;
            BigDecimal payables = Money.ZERO;
            for (CompanyLedger ledger : ledgersByCompany(all).values()) {
                if (ledger.getReceivable().signum() > 0) {
                    receivables = receivables.add(ledger.getReceivable());
                }
                if (ledger.getPayable().signum() > 0) {
                    payables = payables.add(ledger.getPayable());
                }
            }

            int activeProjects = (int) projects.stream()
                .filter(project -> project.isActive() && project.getStatus() == ProjectStatus.ACTIVE)
                .count();

            return DashboardStats.builder()
                .totals(BalanceCalculator.calculateDashboardTotals(all))
                .activeProjects(activeProjects)
                .totalProjects(projects.size())
                .activeCompanies(companies.size())
                .totalReceivables(receivables)
                .totalPayables(payables)
                .build();
        });
    }

    /**
     * Every active company with its running account, ordered by name.
     */
    public List<CompanyBalance> companiesWithBalance() {
        return boundary.withReadTransaction(() -> {
            Map<UUID, CompanyLedger> ledgers = ledgersByCompany(transactionStore.findDetails(TransactionFilter.ALL));
            CompanyLedger empty = BalanceCalculator.calculateCompanyLedger(List.of());

            List<CompanyBalance> result = new ArrayList<>();
            for (Company company : companyStore.findAll(null, false)) {
                result.add(new CompanyBalance(company, ledgers.getOrDefault(company.getId(), empty)));
            }
            return result;
        });
    }

    private static Map<UUID, CompanyLedger> ledgersByCompany(List<TransactionDetails> transactions) {
        Map<UUID, List<TransactionDetails>> grouped = new LinkedHashMap<>();
        for (TransactionDetails transaction : transactions) {
            UUID companyId = transaction.getTransaction().getCompanyId();
            if (companyId != null) {
                grouped.computeIfAbsent(companyId, id -> new ArrayList<>()).add(transaction);
            }
        }
        Map<UUID, CompanyLedger> ledgers = new LinkedHashMap<>();
        grouped.forEach((companyId, rows) -> ledgers.put(companyId, BalanceCalculator.calculateCompanyLedger(rows)));
        return ledgers;
    }
}
