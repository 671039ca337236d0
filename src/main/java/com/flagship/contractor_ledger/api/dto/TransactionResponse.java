package com.flagship.contractor_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contractor_ledger.transaction.LedgerTransaction;
import com.flagship.contractor_ledger.transaction.TransactionDetails;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Response DTO for a transaction with its display names and allocation state.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("scope")
    String scope;

    @JsonProperty("type")
    String type;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("company_name")
    String companyName;

    @JsonProperty("project_id")
    UUID projectId;

    @JsonProperty("project_name")
    String projectName;

    @JsonProperty("category_id")
    UUID categoryId;

    @JsonProperty("category_name")
    String categoryName;

    @JsonProperty("category_color")
    String categoryColor;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("amount_in_base")
    BigDecimal amountInBase;

    @JsonProperty("allocated_amount")
    BigDecimal allocatedAmount;

    @JsonProperty("unallocated_amount")
    BigDecimal unallocatedAmount;

    @JsonProperty("document_no")
    String documentNo;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionResponse from(TransactionDetails details) {
        LedgerTransaction tx = details.getTransaction();
        return TransactionResponse.builder()
            .id(tx.getId())
            .scope(tx.getScope().code())
            .type(tx.getType().code())
            .companyId(tx.getCompanyId())
            .companyName(details.getCompanyName())
            .projectId(tx.getProjectId())
            .projectName(details.getProjectName())
            .categoryId(tx.getCategoryId())
            .categoryName(details.getCategoryName())
            .categoryColor(details.getCategoryColor())
            .date(tx.getDate())
            .description(tx.getDescription())
            .amount(tx.getAmount())
            .currency(tx.getCurrency().name())
            .exchangeRate(tx.getExchangeRate())
            .amountInBase(tx.getAmountInBase())
            .allocatedAmount(details.getAllocatedAmount())
            .unallocatedAmount(details.getUnallocatedAmount())
            .documentNo(tx.getDocumentNo())
            .notes(tx.getNotes())
            .createdAt(tx.getCreatedAt())
            .updatedAt(tx.getUpdatedAt())
            .build();
    }
}
