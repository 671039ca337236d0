package com.flagship.contractor_ledger.api;

import com.flagship.contractor_ledger.balance.CompanyBalance;
import com.flagship.contractor_ledger.balance.CompanyLedger;
import com.flagship.contractor_ledger.balance.DashboardStats;
import com.flagship.contractor_ledger.balance.DashboardTotals;
import com.flagship.contractor_ledger.balance.LedgerSummaryService;
import com.flagship.contractor_ledger.balance.ProjectLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-only balance rollups.
 */
@RestController
@RequestMapping("/api/summary")
@RequiredArgsConstructor
public class SummaryController {

    private final LedgerSummaryService summaryService;

    @GetMapping("/companies/{id}")
    public CompanyLedger companyLedger(@PathVariable UUID id) {
        return summaryService.companyLedger(id);
    }

    @GetMapping("/projects/{id}")
    public ProjectLedger projectLedger(@PathVariable UUID id) {
        return summaryService.projectLedger(id);
    }

    @GetMapping("/dashboard")
    public DashboardTotals dashboard() {
        return summaryService.dashboardTotals();
    }

    @GetMapping("/dashboard/stats")
    public DashboardStats dashboardStats() {
        return summaryService.dashboardStats();
    }

    @GetMapping("/company-balances")
    public List<CompanyBalance> companyBalances() {
        return summaryService.companiesWithBalance();
    }
}
