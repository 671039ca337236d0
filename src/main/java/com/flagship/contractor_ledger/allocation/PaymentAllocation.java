package com.flagship.contractor_ledger.allocation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Part of a payment applied to one invoice, in base currency.
 * At most one row exists per (payment, invoice) pair.
 */
@Value
@Builder
@Jacksonized
public class PaymentAllocation {
    UUID id;
    UUID paymentId;
    UUID invoiceId;
    BigDecimal amount;
    Instant createdAt;
}
