package com.flagship.contractor_ledger.allocation;

import com.flagship.contractor_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An invoice with an unsettled remainder, as offered for allocation.
 */
@Value
@Builder(toBuilder = true)
public class OpenInvoice {
    UUID invoiceId;
    TransactionType type;
    LocalDate date;
    long sequenceNumber;
    String description;
    String documentNo;
    String companyName;
    BigDecimal amountInBase;
    BigDecimal allocatedTotal;
    BigDecimal remaining;
}
