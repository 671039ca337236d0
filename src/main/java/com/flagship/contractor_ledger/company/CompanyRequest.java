package com.flagship.contractor_ledger.company;

import lombok.Builder;
import lombok.Value;

/**
 * Input for creating a company. Fields are already validated by the caller.
 */
@Value
@Builder
public class CompanyRequest {
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
}
