package com.flagship.contractor_ledger.project;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Partial project update; null fields are left unchanged. Switching ownership to
 * {@link OwnershipType#OWN} clears the client company.
 */
@Value
@Builder
public class ProjectUpdate {
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
    Boolean active;
}
