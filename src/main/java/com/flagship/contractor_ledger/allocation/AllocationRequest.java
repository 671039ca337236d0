package com.flagship.contractor_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One line of a payment's allocation set: how much of the payment goes to which invoice.
 */
@Value
public class AllocationRequest {
    UUID invoiceId;
    BigDecimal amount;

    public static AllocationRequest of(UUID invoiceId, BigDecimal amount) {
        return new AllocationRequest(invoiceId, amount);
    }
}
