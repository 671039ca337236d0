package com.flagship.contractor_ledger.transaction;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An invoice or payment as stored.
 *
 * The exchange rate is fixed when the transaction is created and {@code amountInBase} is derived
 * from it, so later rate movements never change historical balances. {@code sequenceNumber} is the
 * insertion order and breaks ties between transactions dated the same day.
 *
 * {@code linkedInvoiceId} is the single-invoice link used before payment allocations existed.
 * It is kept readable but never written by new code.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LedgerTransaction {
    UUID id;
    long sequenceNumber;
    TransactionScope scope;
    UUID companyId;
    UUID projectId;
    TransactionType type;
    UUID categoryId;
    LocalDate date;
    String description;
    BigDecimal amount;
    CurrencyCode currency;
    BigDecimal exchangeRate;
    BigDecimal amountInBase;
    String documentNo;
    String notes;
    UUID linkedInvoiceId;
    Instant createdAt;
    Instant updatedAt;
}
