package com.flagship.contractor_ledger.company;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * A counterparty of the firm: customer, supplier, subcontractor or investor.
 * Every cari (running account) transaction belongs to exactly one company.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Company {
    UUID id;
    CompanyKind kind;
    CompanyRole role;
    String name;
    String nationalId;
    String taxOffice;
    String taxNumber;
    String contactPerson;
    String phone;
    String email;
    String address;
    String bankName;
    String iban;
    String notes;
    boolean active;
    Instant createdAt;
    Instant updatedAt;
}
