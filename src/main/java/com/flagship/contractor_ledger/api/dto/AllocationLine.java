package com.flagship.contractor_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contractor_ledger.allocation.AllocationRequest;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One allocation line in a request body.
 */
@Value
public class AllocationLine {

    @NotNull(message = "Invoice ID is required")
    @JsonProperty("invoice_id")
    UUID invoiceId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.00", message = "Amount must not be negative")
    @JsonProperty("amount")
    BigDecimal amount;

    public AllocationRequest toRequest() {
        return AllocationRequest.of(invoiceId, amount);
    }
}
