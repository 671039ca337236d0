package com.flagship.contractor_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contractor_ledger.project.OwnershipType;
import com.flagship.contractor_ledger.project.ProjectRequest;
import com.flagship.contractor_ledger.project.ProjectStatus;
import com.flagship.contractor_ledger.project.ProjectUpdate;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Project body for both create and update. A blank code on create gets a generated one.
 */
@Value
public class ProjectPayload {

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("ownership")
    OwnershipType ownership;

    @JsonProperty("client_company_id")
    UUID clientCompanyId;

    @JsonProperty("status")
    ProjectStatus status;

    @JsonProperty("location")
    String location;

    @DecimalMin(value = "0.00", message = "Estimated budget must not be negative")
    @JsonProperty("estimated_budget")
    BigDecimal estimatedBudget;

    @JsonProperty("planned_start")
    LocalDate plannedStart;

    @JsonProperty("planned_end")
    LocalDate plannedEnd;

    @JsonProperty("actual_start")
    LocalDate actualStart;

    @JsonProperty("actual_end")
    LocalDate actualEnd;

    @JsonProperty("description")
    String description;

    @JsonProperty("active")
    Boolean active;

    public ProjectRequest toRequest() {
        return ProjectRequest.builder()
            .code(code)
            .name(name)
            .ownership(ownership)
            .clientCompanyId(clientCompanyId)
            .status(status)
            .location(location)
            .estimatedBudget(estimatedBudget)
            .plannedStart(plannedStart)
            .plannedEnd(plannedEnd)
            .actualStart(actualStart)
            .actualEnd(actualEnd)
            .description(description)
            .build();
    }

    public ProjectUpdate toUpdate() {
        return ProjectUpdate.builder()
            .code(code)
            .name(name)
            .ownership(ownership)
            .clientCompanyId(clientCompanyId)
            .status(status)
            .location(location)
            .estimatedBudget(estimatedBudget)
            .plannedStart(plannedStart)
            .plannedEnd(plannedEnd)
            .actualStart(actualStart)
            .actualEnd(actualEnd)
            .description(description)
            .active(active)
            .build();
    }
}
