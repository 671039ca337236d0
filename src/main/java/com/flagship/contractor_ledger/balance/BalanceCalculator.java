package com.flagship.contractor_ledger.balance;

import com.flagship.contractor_ledger.common.Money;
import com.flagship.contractor_ledger.project.OwnershipType;
import com.flagship.contractor_ledger.transaction.TransactionDetails;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

import static com.flagship.contractor_ledger.transaction.TransactionType.INVOICE_IN;
import static com.flagship.contractor_ledger.transaction.TransactionType.INVOICE_OUT;
import static com.flagship.contractor_ledger.transaction.TransactionType.PAYMENT_IN;
import static com.flagship.contractor_ledger.transaction.TransactionType.PAYMENT_OUT;

/**
 * Pure rollups turning a transaction set into the summary of one view.
 *
 * All four share the single pass of {@link TypeTotals}. They read base-currency amounts only and
 * never touch storage.
 *
 * The company and project views deliberately disagree on payments. A running account drops as
 * soon as any payment is recorded. A project only counts a payment against its open invoices once
 * the payment is allocated to them; until then the payment is independent income or expense.
 */
public final class BalanceCalculator {

    private BalanceCalculator() {
    }

    /**
     * Cari view: {@code receivable = invoice_out - payment_in}, {@code payable = invoice_in - payment_out},
     * {@code balance = receivable - payable}, all with full payment totals.
     */
    public static CompanyLedger calculateCompanyLedger(Collection<TransactionDetails> transactions) {
        TypeTotals totals = TypeTotals.accumulate(transactions);

        BigDecimal receivable = totals.total(INVOICE_OUT).subtract(totals.total(PAYMENT_IN));
        BigDecimal payable = totals.total(INVOICE_IN).subtract(totals.total(PAYMENT_OUT));

        return CompanyLedger.builder()
            .totalInvoiceOut(totals.total(INVOICE_OUT))
            .totalPaymentIn(totals.total(PAYMENT_IN))
            .totalInvoiceIn(totals.total(INVOICE_IN))
            .totalPaymentOut(totals.total(PAYMENT_OUT))
            .receivable(receivable)
            .payable(payable)
            .balance(receivable.subtract(payable))
            .build();
    }

    /**
     * Project view. Debt and receivable are floored at zero.
     *
     * @param estimatedBudget may be null, in which case no estimated profit is reported
     */
    public static ProjectLedger calculateProjectLedger(Collection<TransactionDetails> transactions,
                                                       OwnershipType ownership,
                                                       BigDecimal estimatedBudget) {
        TypeTotals totals = TypeTotals.accumulate(transactions);

        BigDecimal independentIn = totals.independent(PAYMENT_IN);
        BigDecimal independentOut = totals.independent(PAYMENT_OUT);
        BigDecimal totalIncome = totals.total(INVOICE_OUT).add(independentIn);
        BigDecimal totalExpense = totals.total(INVOICE_IN).add(independentOut);

        BigDecimal estimatedProfit = estimatedBudget != null ? estimatedBudget.subtract(totalExpense) : null;
        BigDecimal budgetUsed = Money.ZERO;
        if (estimatedBudget != null && estimatedBudget.signum() > 0) {
            budgetUsed = totalExpense.multiply(Money.HUNDRED).divide(estimatedBudget, Money.SCALE, RoundingMode.HALF_UP);
        }

        return ProjectLedger.builder()
            .ownership(ownership)
            .totalInvoiceOut(totals.total(INVOICE_OUT))
            .totalInvoiceIn(totals.total(INVOICE_IN))
            .totalPaymentIn(totals.total(PAYMENT_IN))
            .totalPaymentOut(totals.total(PAYMENT_OUT))
            .independentPaymentIn(independentIn)
            .independentPaymentOut(independentOut)
            .totalIncome(totalIncome)
            .totalExpense(totalExpense)
            .profit(totalIncome.subtract(totalExpense))
            .estimatedBudget(estimatedBudget)
            .estimatedProfit(estimatedProfit)
            .budgetUsedPercent(budgetUsed)
            .projectDebt(Money.nonNegative(totals.total(INVOICE_IN).subtract(totals.allocated(PAYMENT_OUT))))
            .clientReceivable(Money.nonNegative(totals.total(INVOICE_OUT).subtract(totals.allocated(PAYMENT_IN))))
            .build();
    }

    public static DashboardTotals calculateDashboardTotals(Collection<TransactionDetails> transactions) {
        TypeTotals totals = TypeTotals.accumulate(transactions);

        BigDecimal income = totals.total(INVOICE_OUT);
        BigDecimal expense = totals.total(INVOICE_IN);
        BigDecimal collected = totals.total(PAYMENT_IN);
        BigDecimal paid = totals.total(PAYMENT_OUT);

        return DashboardTotals.builder()
            .totalIncome(income)
            .totalExpense(expense)
            .netProfit(income.subtract(expense))
            .totalCollected(collected)
            .totalPaid(paid)
            .netCash(collected.subtract(paid))
            .build();
    }

    public static TransactionTotals calculateTransactionTotals(Collection<TransactionDetails> transactions) {
        TypeTotals totals = TypeTotals.accumulate(transactions);

        BigDecimal income = totals.total(INVOICE_OUT).add(totals.total(PAYMENT_IN));
        BigDecimal expense = totals.total(INVOICE_IN).add(totals.total(PAYMENT_OUT));

        return TransactionTotals.builder()
            .count(totals.count())
            .totalIncome(income)
            .totalExpense(expense)
            .netProfit(totals.total(INVOICE_OUT).subtract(totals.total(INVOICE_IN)))
            .netCashFlow(totals.total(PAYMENT_IN).subtract(totals.total(PAYMENT_OUT)))
            .netBalance(income.subtract(expense))
            .build();
    }
}
