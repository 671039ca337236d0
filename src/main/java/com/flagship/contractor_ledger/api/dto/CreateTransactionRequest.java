package com.flagship.contractor_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contractor_ledger.allocation.AllocationRequest;
import com.flagship.contractor_ledger.transaction.CurrencyCode;
import com.flagship.contractor_ledger.transaction.TransactionRequest;
import com.flagship.contractor_ledger.transaction.TransactionScope;
import com.flagship.contractor_ledger.transaction.TransactionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Request DTO for recording an invoice or payment.
 *
 * A payment may carry explicit {@code allocations}, or set {@code auto_allocate} to have it
 * allocated oldest invoice first. The two are mutually exclusive.
 */
@Value
public class CreateTransactionRequest {

    @NotNull(message = "Scope is required")
    @JsonProperty("scope")
    TransactionScope scope;

    @NotNull(message = "Type is required")
    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("category_id")
    UUID categoryId;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Amount is required")
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

    @Valid
    @JsonProperty("allocations")
    List<AllocationLine> allocations;

    @JsonProperty("auto_allocate")
    Boolean autoAllocate;

    public boolean hasAllocations() {
        return allocations != null && !allocations.isEmpty();
    }

    public boolean isAutoAllocate() {
        return Boolean.TRUE.equals(autoAllocate);
    }

    public List<AllocationRequest> toAllocationRequests() {
        return allocations.stream().map(AllocationLine::toRequest).collect(Collectors.toList());
    }

    public TransactionRequest toDomain() {
        return TransactionRequest.builder()
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
