package com.flagship.contractor_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Partial transaction update; null fields are left unchanged.
 *
 * Currency and exchange rate are locked at creation. They may be repeated with their stored
 * values but any change is rejected.
 */
@Value
@Builder
public class TransactionUpdate {
    TransactionScope scope;
    TransactionType type;
    UUID companyId;
    UUID projectId;
    UUID categoryId;
    LocalDate date;
    String description;
    BigDecimal amount;
    CurrencyCode currency;
    BigDecimal exchangeRate;
    String documentNo;
    String notes;
}
