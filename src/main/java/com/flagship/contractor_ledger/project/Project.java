package com.flagship.contractor_ledger.project;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A construction project. Client-owned projects carry the client company; own projects never do.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Project {
    UUID id;
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
    boolean active;
    Instant createdAt;
    Instant updatedAt;
}
