package com.flagship.contractor_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contractor_ledger.transaction.CurrencyCode;
import com.flagship.contractor_ledger.transaction.TransactionScope;
import com.flagship.contractor_ledger.transaction.TransactionType;
import com.flagship.contractor_ledger.transaction.TransactionUpdate;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Partial update; absent fields keep their stored values.
 */
@Value
public class UpdateTransactionRequest {

    @JsonProperty("scope")
    TransactionScope scope;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("document_no")
    String documentNo;

    @JsonProperty("notes")
    String notes;

    public TransactionUpdate toDomain() {
        return TransactionUpdate.builder()
            .scope(scope)
            .type(type)
            .companyId(companyId)
            .projectId(projectId)
            .categoryId(categoryId)
            .date(date)
            .description(description)
            .amount(amount)
            .currency(currency)
            .exchangeRate(exchangeRate)
            .documentNo(documentNo)
            .notes(notes)
            .build();
    }
}
