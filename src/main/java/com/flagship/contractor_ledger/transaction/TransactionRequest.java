package com.flagship.contractor_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for recording an invoice or payment.
 *
 * {@code currency} defaults to the base currency, in which case the exchange rate is 1 and
 * any supplied rate is ignored. Foreign-currency requests must carry a positive rate.
 */
@Value
@Builder
public class TransactionRequest {
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
