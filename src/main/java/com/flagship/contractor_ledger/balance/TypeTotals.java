package com.flagship.contractor_ledger.balance;

import com.flagship.contractor_ledger.common.Money;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import com.flagship.contractor_ledger.transaction.TransactionType;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-type sums over a transaction set, collected in one pass.
 *
 * For each type it keeps the base-currency total, the allocated part and the unallocated
 * ("independent") part, where the independent part of each transaction is
 * {@code max(0, amountInBase - allocated)}.
 */
public final class TypeTotals {

    private final Map<TransactionType, BigDecimal> totals = new EnumMap<>(TransactionType.class);
    private final Map<TransactionType, BigDecimal> allocated = new EnumMap<>(TransactionType.class);
    private final Map<TransactionType, BigDecimal> independent = new EnumMap<>(TransactionType.class);
    private int count;

    private TypeTotals() {
        for (TransactionType type : TransactionType.values()) {
            totals.put(type, Money.ZERO);
            allocated.put(type, Money.ZERO);
            independent.put(type, Money.ZERO);
        }
    }

    public static TypeTotals accumulate(Collection<TransactionDetails> transactions) {
        TypeTotals result = new TypeTotals();
        for (TransactionDetails transaction : transactions) {
            result.add(transaction);
        }
        return result;
    }

    private void add(TransactionDetails transaction) {
        TransactionType type = transaction.getType();
        BigDecimal amount = transaction.getAmountInBase();
        BigDecimal allocatedPart = Money.orZero(transaction.getAllocatedAmount()).min(amount);

        totals.merge(type, amount, BigDecimal::add);
        allocated.merge(type, allocatedPart, BigDecimal::add);
        independent.merge(type, Money.nonNegative(amount.subtract(allocatedPart)), BigDecimal::add);
        count++;
    }

    public BigDecimal total(TransactionType type) {
        return totals.get(type);
    }

    public BigDecimal allocated(TransactionType type) {
        return allocated.get(type);
    }

    public BigDecimal independent(TransactionType type) {
        return independent.get(type);
    }

    public int count() {
        return count;
    }
}
