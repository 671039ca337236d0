package com.flagship.contractor_ledger.balance;

import com.flagship.contractor_ledger.project.OwnershipType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Profitability and open exposure of one project.
 *
 * Unlike {@link CompanyLedger}, only the allocated part of a payment reduces the debt and
 * receivable figures. The unallocated part counts as independent income or expense.
 */
@Value
@Builder
public class ProjectLedger {
    OwnershipType ownership;
    BigDecimal totalInvoiceOut;
    BigDecimal totalInvoiceIn;
    BigDecimal totalPaymentIn;
    BigDecimal totalPaymentOut;
    BigDecimal independentPaymentIn;
    BigDecimal independentPaymentOut;
    BigDecimal totalIncome;
    BigDecimal totalExpense;
    BigDecimal profit;
    BigDecimal estimatedBudget;
    /** Null when the project has no budget */
    BigDecimal estimatedProfit;
    BigDecimal budgetUsedPercent;
    BigDecimal projectDebt;
    BigDecimal clientReceivable;
}
