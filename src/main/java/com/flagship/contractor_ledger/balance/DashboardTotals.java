package com.flagship.contractor_ledger.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Firm-wide totals. Income and expense come from invoices only; cash movements are reported
 * separately.
 */
@Value
@Builder
public class DashboardTotals {
    BigDecimal totalIncome;
    BigDecimal totalExpense;
    BigDecimal netProfit;
    BigDecimal totalCollected;
    BigDecimal totalPaid;
    BigDecimal netCash;
}
