package com.flagship.contractor_ledger.allocation;

import com.flagship.contractor_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An allocation joined with the transaction on its other side.
 * For a payment's allocations that is the invoice, for an invoice's allocations the payment.
 */
@Value
@Builder
public class AllocationDetails {
    UUID allocationId;
    UUID paymentId;
    UUID invoiceId;
    BigDecimal amount;
    Instant createdAt;
    TransactionType counterpartType;
    LocalDate counterpartDate;
    String counterpartDescription;
    String counterpartDocumentNo;
    BigDecimal counterpartAmountInBase;
}
