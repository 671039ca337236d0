package com.flagship.contractor_ledger.transaction;

import com.flagship.contractor_ledger.common.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A transaction joined with display names and its allocation total.
 *
 * {@code allocatedAmount} is read from the transaction's own side: for a payment it is what the
 * payment has settled, for an invoice it is what has been settled against it.
 */
@Value
@Builder
public class TransactionDetails {
    LedgerTransaction transaction;
    String companyName;
    String projectName;
    String categoryName;
    String categoryColor;
    BigDecimal allocatedAmount;

    public TransactionType getType() {
        return transaction.getType();
    }

    public BigDecimal getAmountInBase() {
        return transaction.getAmountInBase();
    }

    /**
     * Part of the amount not covered by allocations, never negative.
     */
    public BigDecimal getUnallocatedAmount() {
        return Money.nonNegative(transaction.getAmountInBase().subtract(Money.orZero(allocatedAmount)));
    }

    public static TransactionDetails of(LedgerTransaction transaction, BigDecimal allocatedAmount) {
        return TransactionDetails.builder()
            .transaction(transaction)
            .allocatedAmount(allocatedAmount)
            .build();
    }
}
