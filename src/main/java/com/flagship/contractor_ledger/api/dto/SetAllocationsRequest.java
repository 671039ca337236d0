package com.flagship.contractor_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contractor_ledger.allocation.AllocationRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Replaces a payment's whole allocation set. An empty list clears it.
 */
@Value
public class SetAllocationsRequest {

    @NotNull(message = "Allocations are required")
    @Valid
    @JsonProperty("allocations")
    List<AllocationLine> allocations;

    public List<AllocationRequest> toRequests() {
        return allocations.stream().map(AllocationLine::toRequest).collect(Collectors.toList());
    }
}
