package com.flagship.contractor_ledger.project;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for creating a project. A blank code is replaced by a generated PRJ-year-sequence code.
 */
@Value
@Builder
public class ProjectRequest {
    String code;
    String name;
    OwnershipType ownership;
    UUID clientCompanyId;
    ProjectStatus status;
    String location;
    BigDecimal estimatedBudget;
    LocalDate plannedStart;
    LocalDate plannedEnd;
    LocalDate actualStart;
    LocalDate actualEnd;
    String description;
}
