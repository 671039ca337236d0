package com.flagship.contractor_ledger.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Dashboard headline figures: the firm totals plus counts and open positions across companies.
 */
@Value
@Builder
public class DashboardStats {
    DashboardTotals totals;
    int activeProjects;
    int totalProjects;
    int activeCompanies;
    /** Sum of positive company receivables: what counterparties owe the firm */
    BigDecimal totalReceivables;
    /** Sum of positive company payables: what the firm owes counterparties */
    BigDecimal totalPayables;
}
