package com.flagship.contractor_ledger.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TransactionTotals {
    int count;
    BigDecimal totalIncome;
    BigDecimal totalExpense;
    /** Invoices only */
    BigDecimal netProfit;
    /** Payments only */
    BigDecimal netCashFlow;
    BigDecimal netBalance;
}
